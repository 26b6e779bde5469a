package rs.lukaj.webfetch;


import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

import static java.nio.charset.StandardCharsets.UTF_8;

//you know, other stuff
public class Utils {
    private Utils() {
    }

    /**
     * Decompresses gzip-encoded byte array.
     * @param data data to decompress
     * @return decompressed bytes
     * @throws IOException if {@link GZIPInputStream} throws IOException, i.e. data isn't valid gzip
     */
    //only gzip, since that's the only thing we put in Accept-Encoding
    public static byte[] decompress(byte[] data) throws IOException {
        ByteArrayInputStream bytein = new ByteArrayInputStream(data);
        try(bytein; InputStream compressed = new GZIPInputStream(bytein)) {
            return compressed.readAllBytes();
        }
    }

    /**
     * Decodes %XX escapes into bytes and reads the result as UTF-8. Everything else, '+' included, is
     * left alone.
     * @param encoded percent-encoded string
     * @return decoded string
     * @throws IllegalArgumentException if an escape is truncated or isn't hexadecimal
     */
    public static String percentDecode(String encoded) {
        if(encoded.indexOf('%') == -1) return encoded;
        ByteArrayOutputStream out = new ByteArrayOutputStream(encoded.length());
        byte[] bytes = encoded.getBytes(UTF_8);
        for(int i = 0; i < bytes.length; i++) {
            if(bytes[i] != '%') {
                out.write(bytes[i]);
                continue;
            }
            if(i + 2 >= bytes.length) throw new IllegalArgumentException("Truncated escape at index " + i);
            int hi = Character.digit(bytes[i + 1], 16), lo = Character.digit(bytes[i + 2], 16);
            if(hi == -1 || lo == -1) throw new IllegalArgumentException("Invalid escape at index " + i);
            out.write((hi << 4) | lo);
            i += 2;
        }
        return out.toString(UTF_8);
    }
}
