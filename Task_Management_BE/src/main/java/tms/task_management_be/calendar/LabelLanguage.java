package tms.task_management_be.calendar;

/**
 * Language used when rendering period labels and month names.
 */
public enum LabelLanguage {
    FA,
    EN
}
