package org.learningjava.reorderfields;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class ReorderFieldsApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ReorderFieldsApplication.class);
        if (Arrays.stream(args).anyMatch(a -> a.startsWith("--record-name"))) {
            app.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }
}
