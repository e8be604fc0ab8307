package io.prometheus.awstags;

import com.google.cloud.iam.credentials.v1.GenerateIdTokenRequest;
import com.google.cloud.iam.credentials.v1.GenerateIdTokenResponse;
import com.google.cloud.iam.credentials.v1.IamCredentialsClient;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.ApiGatewayClientBuilder;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.autoscaling.AutoScalingClientBuilder;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.Ec2ClientBuilder;
import software.amazon.awssdk.services.resourcegroupstaggingapi.ResourceGroupsTaggingApiClient;
import software.amazon.awssdk.services.resourcegroupstaggingapi.ResourceGroupsTaggingApiClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleWithWebIdentityCredentialsProvider;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleWithWebIdentityRequest;

/**
 * Builds one client per service and region, using the default credential chain or, when a role
 * ARN is configured, credentials from STS.
 */
final class DefaultAwsClientProvider implements AwsClientProvider {
  private static final String SERVICE_ACCOUNT_NAME_FORMAT = "projects/-/serviceAccounts/%s";

  private static final int WEB_IDENTITY_CREDENTIAL_DURATION_SECONDS = 3600;

  private static final int MAX_RETRIES = 5;
  private static final int MAX_EC2_RETRIES = 10;

  private final String roleArn;
  private final String webIdentityServiceAccount;

  private final Map<String, AwsCredentialsProvider> credentialProviders = new ConcurrentHashMap<>();
  private final Map<String, ResourceGroupsTaggingApiClient> taggingClients =
      new ConcurrentHashMap<>();
  private final Map<String, AutoScalingClient> autoScalingClients = new ConcurrentHashMap<>();
  private final Map<String, ApiGatewayClient> apiGatewayClients = new ConcurrentHashMap<>();
  private final Map<String, Ec2Client> ec2Clients = new ConcurrentHashMap<>();

  /**
   * @param roleArn role to assume, or null to use the default credential chain
   * @param webIdentityServiceAccount GCP service account whose id token is exchanged for the role,
   *     or null to assume the role with the default credentials
   */
  DefaultAwsClientProvider(String roleArn, String webIdentityServiceAccount) {
    this.roleArn = roleArn;
    this.webIdentityServiceAccount = webIdentityServiceAccount;
  }

  @Override
  public ResourceGroupsTaggingApiClient taggingClient(String region) {
    return taggingClients.computeIfAbsent(
        region,
        r -> {
          ResourceGroupsTaggingApiClientBuilder clientBuilder =
              ResourceGroupsTaggingApiClient.builder()
                  .region(Region.of(r))
                  .overrideConfiguration(retries(MAX_RETRIES));
          if (roleArn != null) {
            clientBuilder.credentialsProvider(credentialsProvider(r));
          }
          return clientBuilder.build();
        });
  }

  @Override
  public AutoScalingClient autoScalingClient(String region) {
    return autoScalingClients.computeIfAbsent(
        region,
        r -> {
          AutoScalingClientBuilder clientBuilder =
              AutoScalingClient.builder()
                  .region(Region.of(r))
                  .overrideConfiguration(retries(MAX_RETRIES));
          if (roleArn != null) {
            clientBuilder.credentialsProvider(credentialsProvider(r));
          }
          return clientBuilder.build();
        });
  }

  @Override
  public ApiGatewayClient apiGatewayClient(String region) {
    return apiGatewayClients.computeIfAbsent(
        region,
        r -> {
          ApiGatewayClientBuilder clientBuilder =
              ApiGatewayClient.builder()
                  .region(Region.of(r))
                  .overrideConfiguration(retries(MAX_RETRIES));
          if (roleArn != null) {
            clientBuilder.credentialsProvider(credentialsProvider(r));
          }
          return clientBuilder.build();
        });
  }

  @Override
  public Ec2Client ec2Client(String region) {
    return ec2Clients.computeIfAbsent(
        region,
        r -> {
          Ec2ClientBuilder clientBuilder =
              Ec2Client.builder()
                  .region(Region.of(r))
                  .overrideConfiguration(retries(MAX_EC2_RETRIES));
          if (roleArn != null) {
            clientBuilder.credentialsProvider(credentialsProvider(r));
          }
          return clientBuilder.build();
        });
  }

  private static ClientOverrideConfiguration retries(int numRetries) {
    return ClientOverrideConfiguration.builder()
        .retryPolicy(RetryPolicy.builder().numRetries(numRetries).build())
        .build();
  }

  private AwsCredentialsProvider credentialsProvider(String region) {
    return credentialProviders.computeIfAbsent(region, this::roleCredentialProvider);
  }

  private static String getIdToken(String serviceAccountEmail) throws IOException {
    try (IamCredentialsClient credentialsClient = IamCredentialsClient.create()) {
      GenerateIdTokenResponse idTokenResponse =
          credentialsClient.generateIdToken(
              GenerateIdTokenRequest.newBuilder()
                  .setName(String.format(SERVICE_ACCOUNT_NAME_FORMAT, serviceAccountEmail))
                  .setAudience(serviceAccountEmail)
                  .setIncludeEmail(true)
                  .build());
      return idTokenResponse.getToken();
    }
  }

  private AwsCredentialsProvider roleCredentialProvider(String region) {
    if (webIdentityServiceAccount != null) {
      // the web identity exchange needs no AWS credentials, it only runs on GCP
      return StsAssumeRoleWithWebIdentityCredentialsProvider.builder()
          .stsClient(
              StsClient.builder()
                  .credentialsProvider(AnonymousCredentialsProvider.create())
                  .region(Region.of(region))
                  .build())
          .refreshRequest(
              () -> {
                String idToken;
                try {
                  idToken = getIdToken(webIdentityServiceAccount);
                } catch (IOException e) {
                  throw new RuntimeException("Failed to get id token for role arn: " + roleArn, e);
                }
                String[] roleSplit = roleArn.split("/");
                return AssumeRoleWithWebIdentityRequest.builder()
                    .roleArn(roleArn)
                    .webIdentityToken(idToken)
                    .roleSessionName(roleSplit[roleSplit.length - 1])
                    .durationSeconds(WEB_IDENTITY_CREDENTIAL_DURATION_SECONDS)
                    .build();
              })
          .build();
    }
    StsClient stsClient = StsClient.builder().region(Region.of(region)).build();
    AssumeRoleRequest assumeRoleRequest =
        AssumeRoleRequest.builder().roleArn(roleArn).roleSessionName("aws_tags_exporter").build();
    return StsAssumeRoleCredentialsProvider.builder()
        .stsClient(stsClient)
        .refreshRequest(assumeRoleRequest)
        .build();
  }
}
