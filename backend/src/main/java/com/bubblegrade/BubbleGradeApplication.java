package com.bubblegrade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BubbleGradeApplication {

	public static void main(String[] args) {
		SpringApplication.run(BubbleGradeApplication.class, args);
	}
}
