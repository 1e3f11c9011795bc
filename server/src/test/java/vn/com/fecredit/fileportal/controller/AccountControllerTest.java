package vn.com.fecredit.fileportal.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import vn.com.fecredit.fileportal.model.AccountRepository;
import vn.com.fecredit.fileportal.model.DedupEntryRepository;
import vn.com.fecredit.fileportal.model.FileRecordRepository;
import vn.com.fecredit.fileportal.model.UploadSessionHistoryRepository;
import vn.com.fecredit.fileportal.model.UploadSessionRepository;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class AccountControllerTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private AccountRepository accountRepository;
    @Autowired
    private UploadSessionRepository uploadSessionRepository;
    @Autowired
    private UploadSessionHistoryRepository historyRepository;
    @Autowired
    private FileRecordRepository fileRecordRepository;
    @Autowired
    private DedupEntryRepository dedupEntryRepository;

    @BeforeEach
    public void cleanUp() {
        fileRecordRepository.deleteAll();
        historyRepository.deleteAll();
        uploadSessionRepository.deleteAll();
        dedupEntryRepository.deleteAll();
        accountRepository.deleteAll();
    }

    @Test
    public void testRegisterAndAuthenticate() throws Exception {
        register("{\"username\":\"carol\", \"email\":\"carol@example.com\", \"password\":\"s3cret-pass\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.username").value("carol"))
                .andExpect(jsonPath("$.email").value("carol@example.com"))
                .andExpect(jsonPath("$.password").doesNotExist());

        String stored = accountRepository.findByUsername("carol").orElseThrow().getPassword();
        assertNotEquals("s3cret-pass", stored);

        mockMvc.perform(get("/api/auth/me").with(httpBasic("carol", "s3cret-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("carol"));
        mockMvc.perform(get("/api/auth/me").with(httpBasic("carol", "wrong-pass")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void testDuplicateUsernameIsRejected() throws Exception {
        String body = "{\"username\":\"dave\", \"password\":\"password-1\"}";
        register(body).andExpect(status().isCreated());
        register(body)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("USERNAME_TAKEN"));
    }

    @Test
    public void testInvalidRegistration() throws Exception {
        register("{\"username\":\"erin\", \"password\":\"short\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"))
                .andExpect(jsonPath("$.error").value(containsString("password")));
        register("{\"username\":\"no spaces\", \"password\":\"password-1\"}")
                .andExpect(status().isBadRequest());
        register("{not json")
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testUpdateProfile() throws Exception {
        register("{\"username\":\"frank\", \"email\":\"frank@example.com\", \"password\":\"first-pass\"}")
                .andExpect(status().isCreated());

        mockMvc.perform(put("/api/auth/me").with(httpBasic("frank", "first-pass"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"frank@example.org\", \"password\":\"second-pass\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("frank"))
                .andExpect(jsonPath("$.email").value("frank@example.org"))
                .andExpect(jsonPath("$.password").doesNotExist());

        mockMvc.perform(get("/api/auth/me").with(httpBasic("frank", "first-pass")))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/auth/me").with(httpBasic("frank", "second-pass")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("frank@example.org"));
    }

    @Test
    public void testInvalidProfileUpdate() throws Exception {
        register("{\"username\":\"gina\", \"password\":\"gina-pass\"}").andExpect(status().isCreated());

        updateMe("gina", "gina-pass", "{\"password\":\"short\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));
        updateMe("gina", "gina-pass", "{\"email\":\"not-an-email\"}")
                .andExpect(status().isBadRequest());
        updateMe("gina", "gina-pass", "{}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Nothing to update"));
        mockMvc.perform(put("/api/auth/me")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\":\"another-pass\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void testHealthIsPublic() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.storageMode").value("LOCAL"));
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    }

    private ResultActions updateMe(String user, String password, String json) throws Exception {
        return mockMvc.perform(put("/api/auth/me")
                .with(httpBasic(user, password))
                .contentType(MediaType.APPLICATION_JSON)
                .content(json));
    }

    private ResultActions register(String json) throws Exception {
        return mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json));
    }
}
