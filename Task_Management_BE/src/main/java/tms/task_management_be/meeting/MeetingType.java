package tms.task_management_be.meeting;

public enum MeetingType {
    IN_PERSON,
    ONLINE
}
