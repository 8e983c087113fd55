package com.acme.corna.posts;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public class PostDtos {
    public record CreateRequest(@NotBlank String type, String title, String content, String innerHtml, List<String> uploadedImages) {
        /** Browsers send the string "null" for empty fields; treat it as absent. */
        public CreateRequest normalized() {
            List<String> images = uploadedImages == null ? List.of()
                    : uploadedImages.stream().filter(v -> v != null && !v.equals("null")).toList();
            return new CreateRequest(type, absent(title), absent(content), absent(innerHtml), images);
        }

        private static String absent(String value) {
            return value == null || value.equals("null") ? null : value;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PostView(String type, String created, String postUrl, String title, String content, String caption, List<String> imageUrls) {}

    public record PostList(List<PostView> posts) {}
}
