package com.calai.mealplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MealPlanApplication {

    public static void main(String[] args) {
        SpringApplication.run(MealPlanApplication.class, args);
    }
}
