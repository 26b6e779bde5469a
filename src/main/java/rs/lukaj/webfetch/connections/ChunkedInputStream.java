package rs.lukaj.webfetch.connections;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * InputStream designed to read from HTTP chunked data (Transfer-Encoding: chunked). Use {@link #hasMoreChunks()}
 * to see whether more chunks are remaining and {@link #readChunk()} to read the next chunk.
 * <br/>
 * It is forgiving about the stream ending early: a missing terminator or a truncated last chunk just ends the
 * data. Chunk extensions (";name=value" after the size) are skipped, and trailers after the last chunk are
 * never read.
 */
public class ChunkedInputStream extends InputStream {

    private final InputStream in;
    private long remaining = 0;
    private boolean closed = false;
    private boolean end = false;
    private boolean beginning = true;

    /**
     * @param in input stream positioned at the first chunk size
     */
    public ChunkedInputStream(InputStream in) {
        this.in = in;
    }

    private void ensureOpen() throws IOException {
        if(closed) throw new IOException("Trying to read from closed stream!");
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        if(!hasMoreChunks()) return -1;
        int next = in.read();
        if(next == -1) {
            end = true;
            return -1;
        }
        remaining--;
        return next;
    }

    private void enterChunk() throws IOException {
        if(!beginning) {
            in.read(); in.read(); //CRLF after previous chunk's data
        }
        beginning = false;
        String line = readSizeLine();
        if(line == null) { //stream over before the terminator
            end = true;
            return;
        }
        int semicolon = line.indexOf(';');
        String lenStr = (semicolon == -1 ? line : line.substring(0, semicolon)).trim();
        long len;
        try {
            len = Long.parseLong(lenStr, 16);
        } catch (NumberFormatException e) {
            throw new ContentDecodingException("Ill-formed chunk size: '" + lenStr + "'", e);
        }
        if(len < 0) throw new ContentDecodingException("Negative chunk size: " + len);
        if(len > Integer.MAX_VALUE) throw new ContentDecodingException("Chunk too large: " + len);
        if(len == 0) end = true;
        else remaining = len;
    }

    //reads up to CRLF; null if stream ends first
    private String readSizeLine() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(8);
        int current;
        while((current = in.read()) != -1) {
            if(current == '\r') {
                int next = in.read();
                if(next == '\n' || next == -1) return out.toString(ISO_8859_1);
                out.write(current);
                out.write(next);
            } else {
                out.write(current);
            }
        }
        return null;
    }

    /**
     * Reads bytes to the end of the chunk. If the stream ends early, returns what was there.
     * @return remaining bytes in current chunk
     * @throws IOException
     */
    public byte[] readChunk() throws IOException {
        ensureOpen();
        byte[] chunk = in.readNBytes((int) remaining);
        if(chunk.length < remaining) end = true;
        remaining = 0;
        return chunk;
    }

    /**
     * Checks whether there are more chunks, and enters the next one if needed.
     * @return true if there are more chunks, false otherwise
     * @throws IOException if chunk size can't be parsed
     */
    public boolean hasMoreChunks() throws IOException {
        if(end) return false;
        if(remaining != 0) return true;
        enterChunk();
        return !end;
    }

    @Override
    public int available() throws IOException {
        return in.available();
    }

    @Override
    public void close() {
        closed = true;
    }
}
