package com.collectible.market.collectible_market;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollectibleMarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(CollectibleMarketApplication.class, args);
	}

}
