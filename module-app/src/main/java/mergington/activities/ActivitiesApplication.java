package mergington.activities;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class ActivitiesApplication {

  public static void main(String[] args) {
    SpringApplication.run(ActivitiesApplication.class, args);
  }
}
