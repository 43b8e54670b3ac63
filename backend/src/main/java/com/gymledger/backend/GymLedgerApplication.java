package com.gymledger.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GymLedgerApplication {

	public static void main(String[] args) {
		// Membership dates and tombstones are all evaluated in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(GymLedgerApplication.class, args);
	}

}
