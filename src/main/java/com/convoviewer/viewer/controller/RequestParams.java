package com.convoviewer.viewer.controller;

import com.convoviewer.viewer.cache.CacheTier;
import com.convoviewer.viewer.model.Role;
import com.convoviewer.viewer.model.Source;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing of the string request parameters shared by the controllers.
 * Invalid values raise {@link IllegalArgumentException}, answered with 400.
 */
final class RequestParams {

    private RequestParams() {
    }

    static Source source(String id) {
        return Source.fromId(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + id));
    }

    static List<Source> sources(List<String> ids) {
        List<Source> sources = new ArrayList<>();
        if (ids != null) {
            for (String id : ids) {
                if (StringUtils.hasText(id)) {
                    sources.add(source(id));
                }
            }
        }
        return sources;
    }

    static Role role(String id) {
        if (!StringUtils.hasText(id)) {
            return null;
        }
        return Role.fromId(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + id));
    }

    static CacheTier tier(String name) {
        if (!StringUtils.hasText(name) || "all".equalsIgnoreCase(name.trim())) {
            return null;
        }
        return CacheTier.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown cache tier: " + name));
    }
}
