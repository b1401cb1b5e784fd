package com.phillippitts.agentgovernor.config.logging;

import com.phillippitts.agentgovernor.util.GovernanceLogContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the governance subject of each HTTP request into Log4j2's ThreadContext.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>requestId: X-Request-ID header or a generated UUID, echoed on the response</li>
 *   <li>reviewerId: X-Reviewer-ID header, when present</li>
 *   <li>agentId: path segment after {@code /api/governance/agents/}</li>
 *   <li>appealId: path segment after {@code /api/governance/appeals/}</li>
 *   <li>method and uri</li>
 * </ul>
 *
 * <p>Values present before the request are restored afterwards.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String REVIEWER_ID_HEADER = "X-Reviewer-ID";
    static final String APPEAL_ID = "appealId";

    private static final Pattern AGENT_PATH = Pattern.compile("^/api/governance/agents/([^/]+)(?:/.*)?$");
    private static final Pattern APPEAL_PATH = Pattern.compile("^/api/governance/appeals/([^/]+)(?:/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Map<String, String> context = new LinkedHashMap<>();
        context.put("requestId", requestId);
        String reviewerId = request.getHeader(REVIEWER_ID_HEADER);
        if (reviewerId != null && !reviewerId.isBlank()) {
            context.put("reviewerId", reviewerId);
        }
        String uri = request.getRequestURI();
        putPathId(context, GovernanceLogContext.AGENT_ID, AGENT_PATH, uri);
        putPathId(context, APPEAL_ID, APPEAL_PATH, uri);
        context.put("method", request.getMethod());
        context.put("uri", uri);

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.putAll(context)) {
            chain.doFilter(request, response);
        }
    }

    private static void putPathId(Map<String, String> context, String key, Pattern pattern, String uri) {
        if (uri == null) {
            return;
        }
        Matcher m = pattern.matcher(uri);
        if (m.matches()) {
            context.put(key, m.group(1));
        }
    }
}
