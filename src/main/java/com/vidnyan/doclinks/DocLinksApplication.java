package com.vidnyan.doclinks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * doclinks - keeps documentation references to Java code resolved and fresh.
 */
@SpringBootApplication
public class DocLinksApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DocLinksApplication.class, args)));
    }
}
