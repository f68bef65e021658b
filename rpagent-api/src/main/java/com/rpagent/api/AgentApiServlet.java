package com.rpagent.api;

import com.rpagent.providerconfig.codec.PayloadFormat;
import com.rpagent.providerconfig.codec.ProviderConfigCodec;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code POST /api/v1}: decodes an {@link AgentCall} in the format named by {@code Content-Type},
 * dispatches it and answers in the format chosen from {@code Accept} (the request's format when
 * the client accepts anything). Failures are answered with an {@link ErrorResponse}.
 */
public final class AgentApiServlet extends HttpServlet {

    private static final long serialVersionUID = 1L;
    private static final Logger log = LoggerFactory.getLogger(AgentApiServlet.class);

    private final transient CallDispatcher dispatcher;

    public AgentApiServlet(CallDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Optional<PayloadFormat> requestFormat = PayloadFormat.fromMediaType(req.getContentType());
        if (requestFormat.isEmpty()) {
            sendError(resp, PayloadFormat.JSON, ErrorCode.UNSUPPORTED_MEDIA_TYPE,
                    "Unsupported Content-Type: " + req.getContentType());
            return;
        }
        Optional<PayloadFormat> responseFormat = negotiate(req.getHeader("Accept"), requestFormat.get());
        if (responseFormat.isEmpty()) {
            sendError(resp, requestFormat.get(), ErrorCode.NOT_ACCEPTABLE,
                    "None of the accepted media types is supported: " + req.getHeader("Accept"));
            return;
        }
        PayloadFormat format = responseFormat.get();

        AgentCall call;
        try {
            call = ProviderConfigCodec.read(req.getInputStream().readAllBytes(), requestFormat.get(), AgentCall.class);
        } catch (UncheckedIOException e) {
            sendError(resp, format, ErrorCode.INVALID_REQUEST, "Malformed call: " + e.getCause().getMessage());
            return;
        }

        Object body;
        try {
            body = dispatcher.dispatch(call);
        } catch (RuntimeException e) {
            ErrorCode code = ErrorMapper.codeFor(e);
            if (code == ErrorCode.INTERNAL_ERROR) {
                log.error("Call {} failed", call.getType(), e);
            } else {
                log.warn("Call {} failed with {}: {}", call.getType(), code, e.getMessage());
            }
            sendError(resp, format, code, e.getMessage());
            return;
        }
        send(resp, format, HttpServletResponse.SC_OK, body);
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        methodNotAllowed(req, resp);
    }

    @Override
    protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        methodNotAllowed(req, resp);
    }

    @Override
    protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        methodNotAllowed(req, resp);
    }

    private static void methodNotAllowed(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        resp.setHeader("Allow", "POST");
        sendError(resp, PayloadFormat.JSON, ErrorCode.METHOD_NOT_ALLOWED, req.getMethod() + " is not supported");
    }

    /**
     * Picks the response format from an {@code Accept} header, in the order listed. Wildcards and
     * a missing header select the request's format; quality values are ignored.
     */
    static Optional<PayloadFormat> negotiate(String accept, PayloadFormat requestFormat) {
        if (accept == null || accept.isBlank()) {
            return Optional.of(requestFormat);
        }
        for (String range : accept.split(",")) {
            String mediaType = range.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
            if (mediaType.equals("*/*") || mediaType.equals("application/*")) {
                return Optional.of(requestFormat);
            }
            Optional<PayloadFormat> format = PayloadFormat.fromMediaType(mediaType);
            if (format.isPresent()) {
                return format;
            }
        }
        return Optional.empty();
    }

    private static void sendError(HttpServletResponse resp, PayloadFormat format, ErrorCode code, String message)
            throws IOException {
        send(resp, format, code.getStatus(), new ErrorResponse(code, message));
    }

    private static void send(HttpServletResponse resp, PayloadFormat format, int status, Object body)
            throws IOException {
        byte[] bytes = ProviderConfigCodec.write(body, format);
        resp.setStatus(status);
        resp.setContentType(format.getMediaType());
        resp.setContentLength(bytes.length);
        resp.getOutputStream().write(bytes);
    }
}
