package tms.task_management_be.meeting.recurrence;

/**
 * How a rule that carries both an end date and an occurrence count is treated.
 */
public enum BoundPolicy {
    /** Both bounds apply; generation stops at whichever is reached first. */
    FIRST_BOUND_WINS,
    /** A rule may carry only one of the bounds; supplying both is rejected. */
    MUTUALLY_EXCLUSIVE
}
