package net.shelfsync.adapter.s3;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/** 워커 프로세스당 하나의 S3Client를 만든다 */
public final class S3Clients {
    private S3Clients() {}

    /**
     * @param endpoint  MinIO/LocalStack 등 사용 시. null이면 AWS 기본
     * @param accessKey secretKey와 함께 비어 있으면 DefaultCredentialsProvider
     */
    public static S3Client create(String region, URI endpoint, boolean pathStyleAccess,
                                  String accessKey, String secretKey) {
        var s3Cfg = S3Configuration.builder().pathStyleAccessEnabled(pathStyleAccess).build();
        var builder = S3Client.builder()
                .region(Region.of(region == null || region.isBlank() ? "us-east-1" : region))
                .serviceConfiguration(s3Cfg)
                .httpClient(UrlConnectionHttpClient.create())
                .credentialsProvider(credentials(accessKey, secretKey))
                .overrideConfiguration(ClientOverrideConfiguration.builder().build());
        if (endpoint != null) builder.endpointOverride(endpoint);
        return builder.build();
    }

    static AwsCredentialsProvider credentials(String accessKey, String secretKey) {
        String a = trim(accessKey);
        String s = trim(secretKey);
        if (a != null && s != null) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(a, s));
        }
        return DefaultCredentialsProvider.create();
    }

    private static String trim(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
