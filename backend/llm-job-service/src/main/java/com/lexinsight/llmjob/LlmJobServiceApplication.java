package com.lexinsight.llmjob;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LlmJobServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmJobServiceApplication.class, args);
    }
}
