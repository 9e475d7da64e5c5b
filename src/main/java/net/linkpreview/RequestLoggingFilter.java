/**
 * Request logging and timing filter for HTTP requests
 *
 * Features:
 * - Logs incoming HTTP requests with method, URI, and source IP
 * - Measures and logs request processing duration
 * - Records HTTP response status codes, including for asynchronously completed requests
 * - Skips CORS preflight requests to reduce log noise
 */
package net.linkpreview;

import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    /**
     * Processes HTTP request through the filter chain with logging
     * - Logs request details before processing
     * - Tracks request processing time
     * - Logs completion status and duration
     *
     * @param request The incoming servlet request
     * @param response The servlet response
     * @param chain The filter processing chain
     * @throws IOException If an I/O error occurs during request processing
     * @throws ServletException If a servlet error occurs during processing
     */
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        if (HttpMethod.OPTIONS.matches(req.getMethod()) || req.getDispatcherType() != DispatcherType.REQUEST) {
            chain.doFilter(request, response);
            return;
        }
        String uri = req.getRequestURI();
        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        chain.doFilter(request, response);
        if (req.isAsyncStarted()) {
            req.getAsyncContext().addListener(new CompletionLogger(req.getMethod(), uri, startTime));
            return;
        }
        logCompletion(req.getMethod(), uri, response, startTime);
    }

    private static void logCompletion(String method, String uri, ServletResponse response, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
        logger.info("Completed request: {} {} with status {} in {} ms", method, uri, status, duration);
    }

    /**
     * Logs completion of requests whose controller returned a reactive type.
     */
    private static final class CompletionLogger implements AsyncListener {
        private final String method;
        private final String uri;
        private final long startTime;

        private CompletionLogger(String method, String uri, long startTime) {
            this.method = method;
            this.uri = uri;
            this.startTime = startTime;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            logCompletion(method, uri, event.getSuppliedResponse(), startTime);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            logger.warn("Request timed out: {} {} after {} ms", method, uri, System.currentTimeMillis() - startTime);
        }

        @Override
        public void onError(AsyncEvent event) {
            logger.warn("Request failed: {} {} after {} ms", method, uri, System.currentTimeMillis() - startTime,
                event.getThrowable());
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
