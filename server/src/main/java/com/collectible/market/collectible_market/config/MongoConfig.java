package com.collectible.market.collectible_market.config;

import java.math.BigInteger;
import java.util.List;

import org.springframework.boot.autoconfigure.mongo.MongoProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import com.collectible.market.collectible_market.entity.Money;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

@Configuration
public class MongoConfig {

    @Bean
    MongoClient mongoClient(MongoProperties mongoProperties) {
        return MongoClients.create(mongoProperties.determineUri());
    }

    // Amounts exceed 64 bits, so they are stored as decimal strings of base units.
    @Bean
    MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new MoneyToString(), new StringToMoney()));
    }

    @WritingConverter
    static class MoneyToString implements Converter<Money, String> {
        @Override
        public String convert(Money source) {
            return source.toUnits().toString();
        }
    }

    @ReadingConverter
    static class StringToMoney implements Converter<String, Money> {
        @Override
        public Money convert(String source) {
            return Money.ofUnits(new BigInteger(source));
        }
    }
}
