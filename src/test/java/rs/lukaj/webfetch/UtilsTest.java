package rs.lukaj.webfetch;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPOutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    public void percentDecode() {
        assertEquals("Hello World", Utils.percentDecode("Hello%20World"));
        assertEquals("a+b", Utils.percentDecode("a+b"));
        assertEquals("ž", Utils.percentDecode("%c5%be"));
        assertThrows(IllegalArgumentException.class, () -> Utils.percentDecode("%2"));
        assertThrows(IllegalArgumentException.class, () -> Utils.percentDecode("%zz"));
    }

    @Test
    public void decompress() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try(GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write("squeezed".getBytes(UTF_8));
        }
        assertEquals("squeezed", new String(Utils.decompress(out.toByteArray()), UTF_8));
        assertThrows(IOException.class, () -> Utils.decompress("plain".getBytes(UTF_8)));
    }
}
