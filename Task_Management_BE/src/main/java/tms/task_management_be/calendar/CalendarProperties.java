package tms.task_management_be.calendar;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {
    /** Zone used to derive civil dates from instants, e.g. Asia/Tehran */
    @NotBlank
    private String zone = "Asia/Tehran";
    /** Language of month names and period labels (FA or EN) */
    @NotNull
    private LabelLanguage labelLanguage = LabelLanguage.FA;

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }
    public LabelLanguage getLabelLanguage() { return labelLanguage; }
    public void setLabelLanguage(LabelLanguage labelLanguage) { this.labelLanguage = labelLanguage; }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
