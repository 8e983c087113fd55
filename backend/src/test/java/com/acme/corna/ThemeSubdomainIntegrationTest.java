package com.acme.corna;

import com.acme.corna.themes.ThemeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class ThemeSubdomainIntegrationTest extends IntegrationTestBase {
    static final String THEME_FILE = "museum/index.html";

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    ThemeProperties themeProperties;

    @BeforeEach
    void writeThemeFiles() throws Exception {
        Path file = themeProperties.root().resolve(THEME_FILE);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "<html><body>museum</body></html>", StandardCharsets.UTF_8);
    }

    @Test
    void themeLifecycleAndSubdomainPages() throws Exception {
        String ownerName = unique("curator");
        Cookie owner = signUp(ownerName);
        String domain = unique("museum");
        createCorna(owner, domain, "The Museum");

        var thumb = mvc.perform(multipart("/api/v1/media/upload")
                        .file(new MockMultipartFile("image", "thumb.png", "image/png", PostsIntegrationTest.png(16, 9)))
                        .param("type", "thumbnail")
                        .cookie(owner))
                .andExpect(status().isCreated())
                .andReturn();
        String thumbExt = objectMapper.readTree(thumb.getResponse().getContentAsString()).path("url_extension").asText();

        String themeName = unique("museum-theme");
        mvc.perform(post("/api/v1/themes")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + ownerName + "\",\"name\":\"" + themeName + "\",\"description\":\"Gallery walls\",\"path\":\"" + THEME_FILE + "\",\"thumbnail\":\"" + thumbExt + "\"}"))
                .andExpect(status().isCreated());

        mvc.perform(post("/api/v1/themes")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + ownerName + "\",\"name\":\"" + themeName + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Theme already exists"));

        var themes = mvc.perform(get("/api/v1/themes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.themes[?(@.name == '" + themeName + "')].creator").value(hasItem(ownerName)))
                .andExpect(jsonPath("$.themes[?(@.name == '" + themeName + "')].thumbnail").value(hasItem("https://api.test.local/v1/media/download/" + thumbExt)))
                .andReturn();
        String themeId = null;
        for (JsonNode theme : objectMapper.readTree(themes.getResponse().getContentAsString()).path("themes")) {
            if (theme.path("name").asText().equals(themeName)) themeId = theme.path("id").asText();
        }

        mvc.perform(get("/subdomain/" + domain))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No theme found for Corna"));

        mvc.perform(put("/api/v1/corna/" + domain + "/theme")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"theme_id\":\"" + themeId + "\"}"))
                .andExpect(status().isNoContent());

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"text\",\"title\":\"Opening\",\"content\":\"Doors open\",\"inner_html\":\"<p onclick=\\\"x()\\\">Doors <b>open</b></p>\"}"))
                .andExpect(status().isCreated());

        var home = mvc.perform(get("/subdomain/" + domain))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("The Museum"))
                .andExpect(jsonPath("$.theme").value(THEME_FILE))
                .andExpect(jsonPath("$.posts", hasSize(1)))
                .andExpect(jsonPath("$.posts[0].domain_name").value(domain))
                .andExpect(jsonPath("$.posts[0].title").value("Opening"))
                .andExpect(jsonPath("$.posts[0].content").value("<p>Doors <b>open</b></p>"))
                .andReturn();
        String href = objectMapper.readTree(home.getResponse().getContentAsString()).path("posts").get(0).path("href").asText();

        mvc.perform(get("/subdomain/" + domain + "/fragment/" + href))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.href").value(href))
                .andExpect(jsonPath("$.type").value("text"));

        mvc.perform(get("/subdomain/" + domain + "/fragment/nothere1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Post does not exist."));

        mvc.perform(get("/subdomain/static/" + THEME_FILE))
                .andExpect(status().isOk())
                .andExpect(content().string("<html><body>museum</body></html>"));

        mvc.perform(post("/api/v1/posts/" + domain + "/post")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"text\",\"title\":\"Notice\",\"content\":\"<script>raw</script>\"}"))
                .andExpect(status().isCreated());

        mvc.perform(get("/subdomain/" + domain.toUpperCase(Locale.ROOT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("The Museum"))
                .andExpect(jsonPath("$.posts", hasSize(2)))
                .andExpect(jsonPath("$.posts[?(@.title == 'Notice')]", hasSize(1)))
                .andExpect(jsonPath("$.posts[?(@.title == 'Notice')].content").doesNotExist());
    }

    @Test
    void themeStatusUpdates() throws Exception {
        String creator = unique("designer");
        Cookie session = signUp(creator);
        String themeName = unique("draft");

        mvc.perform(post("/api/v1/themes")
                        .cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + creator + "\",\"name\":\"" + themeName + "\"}"))
                .andExpect(status().isCreated());
        mvc.perform(get("/api/v1/themes"))
                .andExpect(jsonPath("$.themes[*].name", not(hasItem(themeName))));

        mvc.perform(put("/api/v1/themes/status")
                        .cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + creator + "\",\"name\":\"" + themeName + "\",\"status\":\"merged\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot set status to merged without valid path"));

        mvc.perform(put("/api/v1/themes/status")
                        .cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + creator + "\",\"name\":\"" + themeName + "\",\"path\":\"" + THEME_FILE + "\",\"status\":\"merged\"}"))
                .andExpect(status().isOk());
        mvc.perform(get("/api/v1/themes"))
                .andExpect(jsonPath("$.themes[*].name", hasItem(themeName)));

        mvc.perform(put("/api/v1/themes/status")
                        .cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + creator + "\",\"name\":\"nope\",\"status\":\"unknown\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No theme exists matching given details"));
    }

    @Test
    void themeCreatorMustExistAndPathMustBeValid() throws Exception {
        String creator = unique("maker");
        Cookie session = signUp(creator);

        mvc.perform(post("/api/v1/themes")
                        .cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"ghost-user\",\"name\":\"x\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Theme creator does not exist"));

        mvc.perform(post("/api/v1/themes")
                        .cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"creator\":\"" + creator + "\",\"name\":\"missing\",\"path\":\"nowhere/index.html\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Theme not in directory"));
    }

    @Test
    void unknownCornaSubdomainIs404() throws Exception {
        mvc.perform(get("/subdomain/" + unique("void")))
                .andExpect(status().isNotFound());
    }
}
