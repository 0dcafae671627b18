package com.paperinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author PaperInsight
 * @since 2026-09-02
 */
@SpringBootApplication
public class PaperInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperInsightApplication.class, args);
    }

}
