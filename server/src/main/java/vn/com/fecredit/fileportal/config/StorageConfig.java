package vn.com.fecredit.fileportal.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import vn.com.fecredit.fileportal.storage.LocalStorageBackend;
import vn.com.fecredit.fileportal.storage.RemoteStorageBackend;

import java.net.URI;
import java.nio.file.Paths;

/**
 * Storage backends. The local backend always exists so files stored before a switch to
 * remote storage stay downloadable; the S3 beans exist only in remote mode.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public LocalStorageBackend localStorageBackend(StorageProperties properties) {
        StorageProperties.Local local = properties.getLocal();
        LocalStorageBackend backend = new LocalStorageBackend(Paths.get(local.getStagingDir()), Paths.get(local.getObjectDir()));
        log.info("Local storage: staging={}, objects={}", backend.getStagingRoot(), backend.getObjectRoot());
        return backend;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "fileportal.storage", name = "mode", havingValue = "remote")
    public S3Client s3Client(StorageProperties properties) {
        StorageProperties.Remote remote = properties.getRemote();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(remote.getRegion()))
                .credentialsProvider(credentials(remote))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(remote.isPathStyleAccess())
                        .build());
        if (StringUtils.hasText(remote.getEndpoint())) {
            builder.endpointOverride(URI.create(remote.getEndpoint()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "fileportal.storage", name = "mode", havingValue = "remote")
    public S3Presigner s3Presigner(StorageProperties properties) {
        StorageProperties.Remote remote = properties.getRemote();
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(remote.getRegion()))
                .credentialsProvider(credentials(remote))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(remote.isPathStyleAccess())
                        .build());
        if (StringUtils.hasText(remote.getEndpoint())) {
            builder.endpointOverride(URI.create(remote.getEndpoint()));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "fileportal.storage", name = "mode", havingValue = "remote")
    public RemoteStorageBackend remoteStorageBackend(S3Client s3Client, S3Presigner s3Presigner, StorageProperties properties) {
        StorageProperties.Remote remote = properties.getRemote();
        if (!StringUtils.hasText(remote.getBucket())) {
            throw new IllegalStateException("fileportal.storage.remote.bucket must be set in remote mode");
        }
        log.info("Remote storage: bucket={}, prefix={}, endpoint={}", remote.getBucket(), remote.getPrefix(),
                StringUtils.hasText(remote.getEndpoint()) ? remote.getEndpoint() : "AWS");
        return new RemoteStorageBackend(s3Client, s3Presigner, remote.getBucket(), remote.getPrefix(), remote.getSignedUrlTtl());
    }

    private static AwsCredentialsProvider credentials(StorageProperties.Remote remote) {
        if (StringUtils.hasText(remote.getAccessKey()) && StringUtils.hasText(remote.getSecretKey())) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(remote.getAccessKey(), remote.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
