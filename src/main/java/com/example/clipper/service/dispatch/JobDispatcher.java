package com.example.clipper.service.dispatch;

import com.example.clipper.DispatchException;
import com.example.clipper.config.CorrelationProperties;
import com.example.clipper.dto.DispatchRequest;
import com.example.clipper.service.github.GithubActionsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Submits the fire-and-forget workflow dispatch carrying the correlation token. It never retries: a
 * second dispatch starts a second remote job, so retrying is left to whoever owns the whole attempt.
 */
@Service
public class JobDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobDispatcher.class);

    private final GithubActionsClient github;
    private final CorrelationProperties correlation;

    public JobDispatcher(GithubActionsClient github, CorrelationProperties correlation) {
        this.github = github;
        this.correlation = correlation;
    }

    /**
     * @throws DispatchException when the platform does not accept the dispatch.
     */
    public void trigger(String targetJob, String ref, Map<String, String> params, String token) {
        DispatchRequest request = DispatchRequest.of(targetJob, ref, token, correlation.getTokenInputKey(), params);
        try {
            github.dispatch(request);
        } catch (DispatchException ex) {
            LOGGER.warn("DISPATCH FAILED workflow={} ref={} token={} status={} body={}",
                    targetJob, ref, token, ex.getHttpStatus(), ex.getBody());
            throw ex;
        }
        LOGGER.info("DISPATCH workflow={} ref={} token={} inputs={}", targetJob, ref, token, request.inputs().keySet());
    }
}
