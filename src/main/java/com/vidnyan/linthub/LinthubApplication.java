package com.vidnyan.linthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * linthub - runs several Python linters and merges their findings into one ordered list.
 */
@SpringBootApplication
public class LinthubApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinthubApplication.class, args);
    }
}
