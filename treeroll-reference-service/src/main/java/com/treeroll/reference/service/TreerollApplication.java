package com.treeroll.reference.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Reference service that wires the REST controllers and the rollup core. */
@SpringBootApplication(scanBasePackages = {"com.treeroll.controller", "com.treeroll.service", "com.treeroll.reference"})
public class TreerollApplication {

    public static void main(String[] args) {
        SpringApplication.run(TreerollApplication.class, args);
    }
}
