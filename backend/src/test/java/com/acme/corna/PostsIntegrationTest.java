package com.acme.corna;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class PostsIntegrationTest extends IntegrationTestBase {
    @Autowired
    ObjectMapper objectMapper;

    @Test
    void ownerCreatesListsAndDeletesTextPost() throws Exception {
        Cookie owner = signUp(unique("writer"));
        String domain = unique("posts");
        createCorna(owner, domain, "Posts");

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"text\",\"title\":\"Hello\",\"content\":\"First words\",\"inner_html\":\"<p>First <script>x</script>words</p>\"}"))
                .andExpect(status().isCreated());

        var listed = mvc.perform(get("/api/v1/posts/" + domain))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.posts", hasSize(1)))
                .andExpect(jsonPath("$.posts[0].type").value("text"))
                .andExpect(jsonPath("$.posts[0].title").value("Hello"))
                .andExpect(jsonPath("$.posts[0].content").value("First words"))
                .andExpect(jsonPath("$.posts[0].post_url").value(startsWith("https://api.test.local/v1/posts/" + domain + "/text/")))
                .andExpect(jsonPath("$.posts[0].image_urls").doesNotExist())
                .andReturn();

        JsonNode body = objectMapper.readTree(listed.getResponse().getContentAsString());
        String postUrl = body.path("posts").get(0).path("post_url").asText();
        String urlExtension = postUrl.substring(postUrl.lastIndexOf('/') + 1);

        mvc.perform(delete("/api/v1/posts/" + domain + "/" + urlExtension).cookie(owner))
                .andExpect(status().isNoContent());
        mvc.perform(get("/api/v1/posts/" + domain))
                .andExpect(jsonPath("$.posts", hasSize(0)));
        mvc.perform(delete("/api/v1/posts/" + domain + "/" + urlExtension).cookie(owner))
                .andExpect(status().isNotFound());
    }

    @Test
    void picturePostLinksUploadedImages() throws Exception {
        Cookie owner = signUp(unique("painter"));
        String domain = unique("gallery");
        createCorna(owner, domain, "Gallery");

        var upload = mvc.perform(multipart("/api/v1/media/upload")
                        .file(new MockMultipartFile("image", "sunset.png", "image/png", png(40, 30)))
                        .cookie(owner))
                .andExpect(status().isCreated())
                .andReturn();
        String imageExt = objectMapper.readTree(upload.getResponse().getContentAsString()).path("url_extension").asText();

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"picture\",\"title\":\"null\",\"content\":\"A sunset\",\"uploaded_images\":[\"" + imageExt + "\"]}"))
                .andExpect(status().isCreated());

        mvc.perform(get("/api/v1/posts/" + domain))
                .andExpect(jsonPath("$.posts[0].type").value("picture"))
                .andExpect(jsonPath("$.posts[0].caption").value("A sunset"))
                .andExpect(jsonPath("$.posts[0].title").doesNotExist())
                .andExpect(jsonPath("$.posts[0].image_urls[0]").value("https://api.test.local/v1/posts/" + domain + "/image/" + imageExt));

        // an image can only be attached once
        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"picture\",\"uploaded_images\":[\"" + imageExt + "\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unable to find file"));
    }

    @Test
    void invalidPostsRejected() throws Exception {
        Cookie owner = signUp(unique("sloppy"));
        String domain = unique("invalid");
        createCorna(owner, domain, "Invalid");

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"poem\",\"content\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("poem is not a valid type of content"));

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"text\",\"title\":\"Only a title\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Text post needs text"));

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"picture\",\"content\":\"caption\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Photo post needs images"));
    }

    @Test
    void writingNeedsPermission() throws Exception {
        Cookie owner = signUp(unique("host"));
        Cookie guest = signUp(unique("guest"));
        String domain = unique("open");
        createCorna(owner, domain, "Open");

        String textPost = "{\"type\":\"text\",\"content\":\"guest post\"}";
        mvc.perform(post("/api/v1/posts/" + domain + "/post").cookie(guest).contentType(MediaType.APPLICATION_JSON).content(textPost))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("User unauthorized to create posts"));

        mvc.perform(put("/api/v1/corna/" + domain + "/permissions")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"permissions\":[\"read\",\"write\"]}"))
                .andExpect(status().isNoContent());

        mvc.perform(post("/api/v1/posts/" + domain + "/post").cookie(guest).contentType(MediaType.APPLICATION_JSON).content(textPost))
                .andExpect(status().isCreated());
    }

    @Test
    void postingNeedsLogin() throws Exception {
        mvc.perform(post("/api/v1/posts/anything/post")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"text\",\"content\":\"x\"}"))
                .andExpect(status().isUnauthorized());
    }

    static byte[] png(int width, int height) throws Exception {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
