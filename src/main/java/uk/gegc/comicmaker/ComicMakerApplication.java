package uk.gegc.comicmaker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ComicMakerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComicMakerApplication.class, args);
    }
}
