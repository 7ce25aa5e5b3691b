package world.willfrog.tracefetch.fetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("world.willfrog.tracefetch.fetch.config")
public class TraceFetchApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TraceFetchApplication.class, args)));
    }
}
