package com.schemeengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Scheme Engine.
 *
 * Scheme Engine runs pooled-capital investment schemes. Contributions from many
 * participants buy a single underlying position through a pluggable order gateway;
 * once that position is sold the proceeds are paid back pro-rata.
 */
@SpringBootApplication
public class SchemeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchemeEngineApplication.class, args);
    }
}
