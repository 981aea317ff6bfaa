package fleetwatch.monitor.model;

/**
 * EC2 action a watchdog alarm triggers.
 */
public enum AlarmAction {
    TERMINATE,
    STOP
}
