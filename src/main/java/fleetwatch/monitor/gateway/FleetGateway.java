package fleetwatch.monitor.gateway;

import fleetwatch.monitor.error.TerminationFailedException;
import fleetwatch.monitor.error.TransientBackendException;

import java.util.List;

/**
 * Fleet membership and termination, as seen by the polling loop.
 */
public interface FleetGateway {

    /**
     * List the worker instances currently provisioned for a cluster.
     *
     * @param clusterTag value of the cluster tag workers are launched with
     * @return live instance IDs, empty when the fleet has drained
     * @throws TransientBackendException when membership could not be read
     */
    List<String> listWorkers(String clusterTag) throws TransientBackendException;

    /**
     * Terminate the given instances. Best effort.
     *
     * @param instanceIds instances to terminate
     * @throws TerminationFailedException when the provider rejected the request
     */
    void terminateInstances(List<String> instanceIds) throws TerminationFailedException;
}
