package tms.task_management_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskManagementBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskManagementBeApplication.class, args);
    }

}
