package uk.ac.ntu.loopserve.server.http;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes one Apache "combined" line per request to the {@code access} logger.
 * The line is written when the response stream closes, so responses completed
 * after the handler returns are logged with their final status and size.
 */
public final class AccessLogFilter extends Filter {
    private static final Logger log = LoggerFactory.getLogger("access");
    private static final DateTimeFormatter CLF =
            DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z", Locale.ENGLISH);

    @Override
    public void doFilter(HttpExchange ex, Chain chain) throws IOException {
        ZonedDateTime started = ZonedDateTime.now();
        Counting out = new Counting(ex.getResponseBody(), () -> log.info(line(ex, started)));
        ex.setStreams(null, out);
        chain.doFilter(ex);
    }

    @Override
    public String description() {
        return "access log (combined)";
    }

    static String line(HttpExchange ex, ZonedDateTime at, long bytes) {
        return Exchanges.remote(ex)
                + " - - [" + CLF.format(at) + "] \""
                + ex.getRequestMethod() + " " + ex.getRequestURI() + " " + ex.getProtocol() + "\" "
                + ex.getResponseCode() + " "
                + (bytes > 0 ? bytes : "-") + " \""
                + orDash(ex.getRequestHeaders().getFirst("Referer")) + "\" \""
                + orDash(ex.getRequestHeaders().getFirst("User-Agent")) + "\"";
    }

    private static String line(HttpExchange ex, ZonedDateTime at) {
        Object out = ex.getResponseBody();
        long bytes = out instanceof Counting c ? c.count : 0;
        return line(ex, at, bytes);
    }

    private static String orDash(String v) {
        return v == null || v.isEmpty() ? "-" : v;
    }

    private static final class Counting extends FilterOutputStream {
        private final Runnable onClose;
        private final AtomicBoolean closed = new AtomicBoolean();
        private long count;

        Counting(OutputStream out, Runnable onClose) {
            super(out);
            this.onClose = onClose;
        }

        @Override
        public void write(int b) throws IOException {
            out.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
            count += len;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                if (closed.compareAndSet(false, true)) onClose.run();
            }
        }
    }
}
