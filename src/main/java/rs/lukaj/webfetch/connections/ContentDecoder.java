package rs.lukaj.webfetch.connections;

import rs.lukaj.webfetch.Utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Turns raw body bytes into text: first undoes chunked transfer encoding, then gzip content encoding, and reads
 * the result as UTF-8. Charset from Content-Type is not looked at.
 */
public class ContentDecoder {

    private ContentDecoder() {
    }

    /**
     * Decode the body of a response with the given headers.
     * @param headers response headers
     * @param rawBody everything after the header/body delimiter
     * @return body text
     * @throws ContentDecodingException if chunk sizes are garbled or gzip data is corrupt
     */
    public static String decode(ResponseHeaders headers, byte[] rawBody) throws ContentDecodingException {
        byte[] data = headers.isChunked() ? dechunk(rawBody) : rawBody;
        if(headers.isGzipped()) data = gunzip(data);
        return new String(data, UTF_8);
    }

    /**
     * Concatenates payloads of all chunks up to the zero-length one. Anything after it (trailers) is ignored.
     * @param body chunked body
     * @return payload bytes
     * @throws ContentDecodingException if a chunk size isn't a hexadecimal number
     */
    public static byte[] dechunk(byte[] body) throws ContentDecodingException {
        ByteArrayOutputStream payload = new ByteArrayOutputStream(body.length);
        try(ChunkedInputStream in = new ChunkedInputStream(new ByteArrayInputStream(body))) {
            while(in.hasMoreChunks()) {
                payload.write(in.readChunk());
            }
        } catch (ContentDecodingException e) {
            throw e;
        } catch (IOException e) { //ByteArrayInputStream doesn't really throw
            throw new ContentDecodingException("Cannot read chunked body", e);
        }
        return payload.toByteArray();
    }

    /**
     * @param data gzip-compressed bytes
     * @return decompressed bytes
     * @throws ContentDecodingException if data isn't valid gzip
     */
    public static byte[] gunzip(byte[] data) throws ContentDecodingException {
        try {
            return Utils.decompress(data);
        } catch (IOException e) {
            throw new ContentDecodingException("Failed to decompress response: " + e.getMessage(), e);
        }
    }
}
