package rs.lukaj.webfetch.connections;

import javax.net.SocketFactory;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;

/**
 * Represents a socket used for communicating with the network. Supports plain (http) and TLS (https)
 * {@link Authority authorities}. Socket and connection are used interchangeably.
 */
public class HttpSocket implements Closeable {
    private final Authority authority;
    private final long openedAt;

    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;

    /**
     * Open a new socket to a given authority. For https, TLS handshake is done right away, with server name
     * indication set to the host and the JVM's default trust store.
     * @param authority authority to connect to
     * @param connectTimeout maximum time for establishing TCP connection, zero for no limit
     * @param readTimeout maximum time a single read can block, zero for no limit
     * @throws IOException if connecting or TLS handshake fails
     */
    public HttpSocket(Authority authority, Duration connectTimeout, Duration readTimeout) throws IOException {
        this.authority = authority;
        Socket plain = SocketFactory.getDefault().createSocket();
        try {
            plain.connect(new InetSocketAddress(authority.getHost(), authority.getPort()), (int) connectTimeout.toMillis());
            plain.setSoTimeout((int) readTimeout.toMillis());
            if(authority.isHttps()) {
                SSLSocket sslSocket = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault())
                        .createSocket(plain, authority.getHost(), authority.getPort(), true);
                if(!isIpLiteral(authority.getHost())) {
                    SSLParameters params = sslSocket.getSSLParameters();
                    params.setServerNames(List.of(new SNIHostName(authority.getHost())));
                    sslSocket.setSSLParameters(params);
                }
                sslSocket.startHandshake();
                socket = sslSocket;
            } else {
                socket = plain;
            }
        } catch (IOException | RuntimeException e) {
            plain.close();
            throw e;
        }
        this.openedAt = System.currentTimeMillis();
        input = socket.getInputStream();
        output = socket.getOutputStream();
    }

    //SNI must not carry IP addresses
    private static boolean isIpLiteral(String host) {
        return host.indexOf(':') != -1 || host.chars().allMatch(c -> Character.isDigit(c) || c == '.');
    }

    /**
     * @return authority this socket is connected to
     */
    public Authority getAuthority() {
        return authority;
    }

    /**
     * Get how old is this socket. Age is calculated as duration between the time it was opened and this moment.
     * @return socket age
     */
    public Duration getAge() {
        return Duration.ofMillis(System.currentTimeMillis() - openedAt);
    }

    /**
     * Write raw bytes to the socket; this sends bytes to the server and flushes the connection.
     * @param bytes data to be sent
     * @throws IOException
     */
    public void write(byte[] bytes) throws IOException {
        output.write(bytes);
        output.flush();
    }

    /**
     * Read at most len bytes into the buffer, starting at offset. This method blocks until at least one byte is
     * available (or read timeout, if any, passes).
     * @param buf buffer used for storing read data
     * @param offset data is stored starting on this index
     * @param len maximum number of bytes to read
     * @return number of bytes read, or -1 if server closed the stream
     * @throws IOException
     */
    public int read(byte[] buf, int offset, int len) throws IOException {
        return input.read(buf, offset, len);
    }

    /**
     * Returns whether the underlying (and, by extension, this) socket is closed. You cannot write to nor read from
     * closed sockets.
     * @return true if socket is closed, false otherwise
     */
    public boolean isClosed() {
        return socket.isClosed();
    }

    /**
     * Close the connection to the server. After closing no more data can be read from or written to this socket.
     * @throws IOException
     */
    @Override
    public void close() throws IOException {
        socket.close();
    }

    @Override
    public String toString() {
        return "HttpSocket[" + authority + ", age " + getAge().toMillis() + "ms]";
    }
}
