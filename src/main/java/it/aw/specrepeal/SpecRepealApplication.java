package it.aw.specrepeal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpecRepealApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpecRepealApplication.class, args);
    }
}
