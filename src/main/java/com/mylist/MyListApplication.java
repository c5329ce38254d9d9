package com.mylist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MyListApplication {

    public static void main(String[] args) {
        SpringApplication.run(MyListApplication.class, args);
    }
}
