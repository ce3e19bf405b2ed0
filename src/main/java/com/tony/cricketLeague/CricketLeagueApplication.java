package com.tony.cricketLeague;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CricketLeagueApplication {

	public static void main(String[] args) {
		SpringApplication.run(CricketLeagueApplication.class, args);
	}

}
