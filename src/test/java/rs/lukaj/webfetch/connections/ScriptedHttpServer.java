package rs.lukaj.webfetch.connections;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Local HTTP server answering every request according to a {@link Script}. Counts connections and records
 * requests, so tests can tell whether anything actually went over the network.
 */
public class ScriptedHttpServer implements Closeable {

    /**
     * Decides what the server sends back for a request path.
     */
    public interface Script {
        Reply respond(String path) throws IOException;
    }

    /**
     * Raw bytes to send and whether the connection stays open for another request.
     */
    public static class Reply {
        final byte[] bytes;
        final boolean keepOpen;

        private Reply(byte[] bytes, boolean keepOpen) {
            this.bytes = bytes;
            this.keepOpen = keepOpen;
        }

        /**
         * Send this and close the connection.
         */
        public static Reply closing(String raw) {
            return new Reply(raw.getBytes(UTF_8), false);
        }
        public static Reply closing(byte[] raw) {
            return new Reply(raw, false);
        }

        /**
         * Send this and wait for the next request on the same connection.
         */
        public static Reply keepOpen(String raw) {
            return new Reply(raw.getBytes(UTF_8), true);
        }
    }

    private final ServerSocket serverSocket;
    private final Script script;
    private final AtomicInteger connections = new AtomicInteger();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<Socket> accepted = new CopyOnWriteArrayList<>();

    public ScriptedHttpServer(Script script) throws IOException {
        this.script = script;
        this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(this::acceptLoop, "scripted-http-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    /**
     * 200 response with Content-Length and any extra header lines (without CRLF).
     */
    public static String ok(String body, String... headers) {
        return response("200 OK", body, headers);
    }

    /**
     * Response with the given status, Content-Length and any extra header lines (without CRLF).
     */
    public static String response(String status, String body, String... headers) {
        StringBuilder sb = new StringBuilder("HTTP/1.1 ").append(status).append("\r\n");
        sb.append("Content-Length: ").append(body.getBytes(UTF_8).length).append("\r\n");
        for(String header : headers) sb.append(header).append("\r\n");
        return sb.append("\r\n").append(body).toString();
    }

    public static String redirect(String location) {
        return response("302 Found", "", "Location: " + location);
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    /**
     * @param path path starting with '/'
     * @return http URL of the path on this server
     */
    public String url(String path) {
        return "http://127.0.0.1:" + getPort() + path;
    }

    /**
     * @return number of connections accepted so far
     */
    public int getConnectionCount() {
        return connections.get();
    }

    /**
     * @return raw requests (request line and headers) received so far, in order
     */
    public List<String> getRequests() {
        return requests;
    }

    private void acceptLoop() {
        while(!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                connections.incrementAndGet();
                accepted.add(socket);
                Thread handler = new Thread(() -> serve(socket), "scripted-http-" + connections.get());
                handler.setDaemon(true);
                handler.start();
            } catch (IOException e) {
                return; //server closed
            }
        }
    }

    private void serve(Socket socket) {
        try(socket) {
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();
            while(true) {
                String request = readRequest(in);
                if(request == null) return;
                requests.add(request);
                String requestLine = request.substring(0, request.indexOf("\r\n"));
                String path = requestLine.split(" ")[1];
                Reply reply = script.respond(path);
                out.write(reply.bytes);
                out.flush();
                if(!reply.keepOpen) return;
            }
        } catch (IOException e) {
            //client went away
        }
    }

    private static String readRequest(InputStream in) throws IOException {
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        int b;
        while((b = in.read()) != -1) {
            head.write(b);
            byte[] bytes = head.toByteArray();
            int n = bytes.length;
            if(n >= 4 && bytes[n-4] == '\r' && bytes[n-3] == '\n' && bytes[n-2] == '\r' && bytes[n-1] == '\n')
                return new String(bytes, ISO_8859_1);
        }
        return null;
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        for(Socket s : accepted) s.close();
    }
}
