package com.spreadsheet.formula;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormulaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormulaEngineApplication.class, args);
    }
}
