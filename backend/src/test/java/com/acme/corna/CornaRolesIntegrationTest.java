package com.acme.corna;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class CornaRolesIntegrationTest extends IntegrationTestBase {

    @Test
    void createCornaAndLookUpDomain() throws Exception {
        Cookie owner = signUp(unique("owner"));
        String domain = unique("blog");
        createCorna(owner, domain, "My Blog");

        mvc.perform(get("/api/v1/corna").cookie(owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.domain_name").value(domain));

        mvc.perform(post("/api/v1/corna/" + unique("again"))
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Second\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("User already has a corna"));
    }

    @Test
    void domainNamesAreUnique() throws Exception {
        Cookie first = signUp(unique("first"));
        Cookie second = signUp(unique("second"));
        String domain = unique("taken");
        createCorna(first, domain, "First");

        mvc.perform(post("/api/v1/corna/" + domain)
                        .cookie(second)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Second\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Domain name already in use"));
    }

    @Test
    void userWithoutCornaGets404() throws Exception {
        Cookie user = signUp(unique("nocorna"));
        mvc.perform(get("/api/v1/corna").cookie(user))
                .andExpect(status().isNotFound());
    }

    @Test
    void ownerManagesRolesAndMembers() throws Exception {
        Cookie owner = signUp(unique("owner"));
        String member = unique("member");
        signUp(member);
        String domain = unique("roles");
        createCorna(owner, domain, "Roles");

        mvc.perform(post("/api/v1/roles")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"editor\",\"permissions\":[\"read\",\"write\"]}"))
                .andExpect(status().isCreated());

        mvc.perform(post("/api/v1/roles")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"editor\",\"permissions\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Duplicate roles are not permitted"));

        mvc.perform(put("/api/v1/roles/permissions/add")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"editor\",\"permission\":\"delete\"}"))
                .andExpect(status().isNoContent());

        mvc.perform(get("/api/v1/roles/" + domain + "/editor/permissions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.permissions.read").value(true))
                .andExpect(jsonPath("$.permissions.write").value(true))
                .andExpect(jsonPath("$.permissions.delete").value(true))
                .andExpect(jsonPath("$.permissions.change_theme").value(false));

        String give = "{\"domain_name\":\"" + domain + "\",\"name\":\"editor\",\"username\":\"" + member + "\"}";
        mvc.perform(post("/api/v1/roles/give").cookie(owner).contentType(MediaType.APPLICATION_JSON).content(give))
                .andExpect(status().isCreated());
        mvc.perform(post("/api/v1/roles/give").cookie(owner).contentType(MediaType.APPLICATION_JSON).content(give))
                .andExpect(status().isCreated());

        mvc.perform(get("/api/v1/roles/" + domain + "/editor/users"))
                .andExpect(jsonPath("$.users", contains(member)));
        mvc.perform(get("/api/v1/roles/" + domain + "/" + member))
                .andExpect(jsonPath("$.roles", contains("editor")));
        mvc.perform(get("/api/v1/roles/" + domain + "/users/write"))
                .andExpect(jsonPath("$.users", contains(member)));
        mvc.perform(get("/api/v1/roles/" + domain))
                .andExpect(jsonPath("$.roles", contains("editor")));

        mvc.perform(post("/api/v1/roles/take").cookie(owner).contentType(MediaType.APPLICATION_JSON).content(give))
                .andExpect(status().isCreated());
        mvc.perform(get("/api/v1/roles/" + domain + "/editor/users"))
                .andExpect(jsonPath("$.users", empty()));

        mvc.perform(delete("/api/v1/roles")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"editor\"}"))
                .andExpect(status().isNoContent());
        mvc.perform(get("/api/v1/roles/" + domain + "/editor/permissions"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void strangerCannotCreateRoles() throws Exception {
        Cookie owner = signUp(unique("owner"));
        Cookie stranger = signUp(unique("stranger"));
        String domain = unique("guarded");
        createCorna(owner, domain, "Guarded");

        mvc.perform(post("/api/v1/roles")
                        .cookie(stranger)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"mods\",\"permissions\":[\"read\"]}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("User can not create a role"));
    }

    @Test
    void roleHolderWithChangePermissionsCanManageRoles() throws Exception {
        Cookie owner = signUp(unique("owner"));
        String adminName = unique("admin");
        Cookie admin = signUp(adminName);
        String domain = unique("shared");
        createCorna(owner, domain, "Shared");

        mvc.perform(post("/api/v1/roles")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"admins\",\"permissions\":[\"change_permissions\"]}"))
                .andExpect(status().isCreated());
        mvc.perform(post("/api/v1/roles/give")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"admins\",\"username\":\"" + adminName + "\"}"))
                .andExpect(status().isCreated());

        mvc.perform(post("/api/v1/roles")
                        .cookie(admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\"writers\",\"permissions\":[\"write\"]}"))
                .andExpect(status().isCreated());
    }

    @Test
    void roleNamedUsersIsReserved() throws Exception {
        Cookie owner = signUp(unique("owner"));
        String domain = unique("reserved");
        createCorna(owner, domain, "Reserved");

        mvc.perform(post("/api/v1/roles")
                        .cookie(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"domain_name\":\"" + domain + "\",\"name\":\" Users \",\"permissions\":[\"read\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Role name 'users' is reserved"));

        mvc.perform(get("/api/v1/roles/" + domain))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roles", empty()));

        mvc.perform(get("/api/v1/roles/" + domain + "/users/users"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown permission 'users'"));
    }

    @Test
    void unknownCornaIsBadRequest() throws Exception {
        mvc.perform(get("/api/v1/roles/" + unique("missing")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Corna does not exist"));
    }
}
