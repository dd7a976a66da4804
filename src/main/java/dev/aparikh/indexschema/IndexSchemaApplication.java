package dev.aparikh.indexschema;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IndexSchemaApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndexSchemaApplication.class, args);
    }

}
