package ru.tigran.quotaadmission;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuotaAdmissionApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaAdmissionApplication.class, args);
    }
}
