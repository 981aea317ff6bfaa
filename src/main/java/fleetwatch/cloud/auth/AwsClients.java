package fleetwatch.cloud.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;

import java.time.Duration;

/**
 * Builds the EC2 and CloudWatch clients for one region.
 * Credentials come from the default provider chain (env, profile, instance role).
 */
public class AwsClients implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AwsClients.class);

    private final Region region;
    private final Ec2Client ec2;
    private final CloudWatchClient cloudWatch;

    public AwsClients(String region) {
        this.region = Region.of(region);
        DefaultCredentialsProvider credentials = DefaultCredentialsProvider.create();

        this.ec2 = Ec2Client.builder()
                .region(this.region)
                .credentialsProvider(credentials)
                .overrideConfiguration(c -> c.apiCallTimeout(Duration.ofMinutes(1)))
                .build();
        this.cloudWatch = CloudWatchClient.builder()
                .region(this.region)
                .credentialsProvider(credentials)
                .overrideConfiguration(c -> c.apiCallTimeout(Duration.ofMinutes(1)))
                .build();
        log.info("AWS clients created for region {}", region);
    }

    public Region region() { return region; }
    public Ec2Client ec2() { return ec2; }
    public CloudWatchClient cloudWatch() { return cloudWatch; }

    @Override
    public void close() {
        ec2.close();
        cloudWatch.close();
    }
}
