package fleetwatch.cloud.fleet;

import fleetwatch.cloud.AwsErrors;
import fleetwatch.monitor.error.TerminationFailedException;
import fleetwatch.monitor.error.TransientBackendException;
import fleetwatch.monitor.gateway.FleetGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.TerminateInstancesRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * FleetGateway backed by EC2.
 * Workers are the pending/running instances carrying the cluster tag and, if configured,
 * the worker Name tag.
 */
public class Ec2FleetGateway implements FleetGateway {

    private static final Logger log = LoggerFactory.getLogger(Ec2FleetGateway.class);

    static final int PAGE_SIZE = 500;

    private final Ec2Client ec2;
    private final String clusterTagKey;
    private final String workerName;

    /**
     * @param clusterTagKey tag key holding the cluster name
     * @param workerName    required value of the Name tag, or null for any
     */
    public Ec2FleetGateway(Ec2Client ec2, String clusterTagKey, String workerName) {
        this.ec2 = ec2;
        this.clusterTagKey = clusterTagKey;
        this.workerName = workerName;
    }

    @Override
    public List<String> listWorkers(String clusterTag) throws TransientBackendException {
        List<String> ids = new ArrayList<>();
        String token = null;
        try {
            do {
                DescribeInstancesResponse page = ec2.describeInstances(DescribeInstancesRequest.builder()
                        .filters(filters(clusterTag))
                        .maxResults(PAGE_SIZE)
                        .nextToken(token)
                        .build());
                for (Reservation reservation : page.reservations()) {
                    for (Instance instance : reservation.instances()) {
                        ids.add(instance.instanceId());
                    }
                }
                token = page.nextToken();
            } while (token != null && !token.isEmpty());
        } catch (SdkException e) {
            if (AwsErrors.isTransient(e)) {
                throw new TransientBackendException("DescribeInstances failed for cluster " + clusterTag
                        + ": " + AwsErrors.describe(e), e);
            }
            // Permanent: permissions or a malformed filter
            log.error("DescribeInstances rejected for cluster {}: {}", clusterTag, AwsErrors.describe(e));
            throw e;
        }
        log.debug("Cluster {} has {} live workers", clusterTag, ids.size());
        return ids;
    }

    @Override
    public void terminateInstances(List<String> instanceIds) throws TerminationFailedException {
        if (instanceIds.isEmpty()) {
            return;
        }
        try {
            ec2.terminateInstances(TerminateInstancesRequest.builder().instanceIds(instanceIds).build());
        } catch (SdkException e) {
            if (AwsErrors.isNotFound(e)) {
                // Already gone; nothing left to terminate
                log.info("Instances {} already gone: {}", instanceIds, AwsErrors.describe(e));
                return;
            }
            throw new TerminationFailedException(instanceIds,
                    "TerminateInstances failed for " + instanceIds + ": " + AwsErrors.describe(e), e);
        }
    }

    List<Filter> filters(String clusterTag) {
        List<Filter> filters = new ArrayList<>();
        filters.add(Filter.builder().name("tag:" + clusterTagKey).values(clusterTag).build());
        if (workerName != null && !workerName.isBlank()) {
            filters.add(Filter.builder().name("tag:Name").values(workerName).build());
        }
        filters.add(Filter.builder().name("instance-state-name").values("pending", "running").build());
        return filters;
    }
}
