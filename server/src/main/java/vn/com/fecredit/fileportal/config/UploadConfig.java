package vn.com.fecredit.fileportal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.fileportal.core.ExpiryReaper;
import vn.com.fecredit.fileportal.service.ChunkedUploadService;

import java.time.Clock;

@Configuration
public class UploadConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExpiryReaper expiryReaper(ChunkedUploadService chunkedUploadService, Clock clock) {
        return new ExpiryReaper(chunkedUploadService, clock);
    }
}
