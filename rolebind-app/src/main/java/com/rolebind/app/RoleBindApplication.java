package com.rolebind.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RoleBind application entry point.
 */
@SpringBootApplication
public class RoleBindApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoleBindApplication.class, args);
    }
}
