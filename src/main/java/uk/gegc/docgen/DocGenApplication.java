package uk.gegc.docgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocGenApplication.class, args);
    }
}
