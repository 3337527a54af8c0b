package io.newsdigest.ingestion.api.service;

import io.newsdigest.ingestion.config.FeedSource;
import io.newsdigest.ingestion.config.HttpConfig;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * User agent for outgoing requests: the source's fixed agent when it has one,
 * otherwise the next configured agent in turn. Shared by feed and page requests.
 */
@Component
public class UserAgentRotation {

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final List<String> userAgents;

    public UserAgentRotation(HttpConfig httpConfig) {
        this.userAgents = httpConfig.userAgents();
    }

    public String forSource(FeedSource source) {
        String hint = source.hints().userAgent();
        if (hint != null && !hint.isBlank()) {
            return hint;
        }
        return next();
    }

    public String next() {
        return userAgents.get(Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size()));
    }
}
