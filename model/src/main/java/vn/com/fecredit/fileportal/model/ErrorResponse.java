package vn.com.fecredit.fileportal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error body returned by every endpoint. {@code action} tells the client whether to
 * resend the chunk, start a new upload, or give up.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorResponse {

    public static final String ACTION_RETRY_CHUNK = "RETRY_CHUNK";
    public static final String ACTION_RESTART_UPLOAD = "RESTART_UPLOAD";
    public static final String ACTION_NONE = "NONE";

    private String error;
    private String code;
    private String action;

    public ErrorResponse() {
    }

    public ErrorResponse(String error, String code, String action) {
        this.error = error;
        this.code = code;
        this.action = action;
    }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }
}
