package org.learningjava.mediadb.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.mediadb")
public class MediaDbApplication {
    public static void main(String[] args) {
        SpringApplication.run(MediaDbApplication.class, args);
    }
}
