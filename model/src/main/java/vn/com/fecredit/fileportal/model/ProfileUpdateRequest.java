package vn.com.fecredit.fileportal.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial update of the caller's own account. Absent fields are left unchanged; the username
 * is fixed since files are owned by it.
 */
public class ProfileUpdateRequest {

    @Email
    @Size(max = 255)
    private String email;

    @Size(min = 8, max = 128)
    private String password;

    public ProfileUpdateRequest() {
    }

    public ProfileUpdateRequest(String email, String password) {
        this.email = email;
        this.password = password;
    }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
}
