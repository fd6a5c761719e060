package it.aw.docorganizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocOrganizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocOrganizerApplication.class, args);
    }
}
