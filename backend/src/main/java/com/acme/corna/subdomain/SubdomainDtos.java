package com.acme.corna.subdomain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public class SubdomainDtos {
    public record ParsedPost(
            String uuid,
            String href,
            String created,
            String type,
            String domainName,
            String title,
            @JsonInclude(JsonInclude.Include.NON_NULL) String content,
            @JsonInclude(JsonInclude.Include.NON_NULL) String caption,
            @JsonInclude(JsonInclude.Include.NON_NULL) List<String> images
    ) {}

    public record Homepage(String title, String theme, List<ParsedPost> posts) {}
}
