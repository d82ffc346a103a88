package com.restaurantguide.search.infrastructure.persistence;

import com.restaurantguide.search.application.port.out.EstablishmentRepository;
import com.restaurantguide.search.domain.model.Category;
import com.restaurantguide.search.domain.model.City;
import com.restaurantguide.search.domain.model.Cuisine;
import com.restaurantguide.search.domain.model.Establishment;
import com.restaurantguide.search.domain.model.EstablishmentStatus;
import com.restaurantguide.search.domain.model.Feature;
import com.restaurantguide.search.domain.model.LabeledValue;
import com.restaurantguide.search.domain.model.PriceRange;
import com.restaurantguide.search.domain.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.List;

/**
 * Data seeder for local development.
 * Runs when app.seeding.enabled=true and the table is empty, so a fresh
 * database has something to search around central Minsk and Grodno.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedLocalData(EstablishmentRepository establishmentRepository) {
        return args -> {
            long existing = establishmentRepository.count();
            if (existing > 0) {
                logger.info("Establishments already present ({}), skipping seeding", existing);
                return;
            }

            logger.info("Seeding local development data...");
            List<Establishment> seeds = seedEstablishments();
            seeds.forEach(establishmentRepository::save);
            logger.info("Local seeding complete: {} establishments", seeds.size());
        };
    }

    static List<Establishment> seedEstablishments() {
        return List.of(
            establishment("Васильки", City.MINSK, "53.902300", "27.561800", "пр-т Независимости, 16",
                new Category[] {Category.RESTAURANT}, new Cuisine[] {Cuisine.NATIONAL}, PriceRange.MODERATE,
                new Feature[] {Feature.WIFI, Feature.KIDS_ZONE}, "10:00", "23:00",
                "4.6", 340, SubscriptionTier.PREMIUM),
            establishment("Кофейня на Немиге", City.MINSK, "53.905000", "27.553000", "ул. Немига, 3",
                new Category[] {Category.COFFEE_SHOP}, new Cuisine[] {Cuisine.CONTINENTAL}, PriceRange.BUDGET,
                new Feature[] {Feature.WIFI, Feature.TERRACE}, "08:00", "22:00",
                "4.8", 120, SubscriptionTier.BASIC),
            establishment("Ночной бар Октябрь", City.MINSK, "53.898500", "27.556200", "ул. Октябрьская, 16",
                new Category[] {Category.BAR, Category.KARAOKE}, new Cuisine[] {Cuisine.MIXED}, PriceRange.MODERATE,
                new Feature[] {Feature.SMOKING_AREA}, "18:00", "04:00",
                "4.2", 85, SubscriptionTier.STANDARD),
            establishment("Пицца Маркет", City.MINSK, "53.915800", "27.584900", "пр-т Независимости, 58",
                new Category[] {Category.PIZZERIA, Category.FAST_FOOD}, new Cuisine[] {Cuisine.ITALIAN, Cuisine.AMERICAN},
                PriceRange.BUDGET, new Feature[] {Feature.DELIVERY, Feature.PARKING}, null, null,
                "4.0", 410, SubscriptionTier.FREE),
            establishment("Токио", City.MINSK, "53.887600", "27.539100", "ул. Куйбышева, 22",
                new Category[] {Category.RESTAURANT}, new Cuisine[] {Cuisine.JAPANESE, Cuisine.ASIAN}, PriceRange.EXPENSIVE,
                new Feature[] {Feature.DELIVERY, Feature.WIFI, Feature.BANQUET}, "12:00", "23:30",
                "4.5", 64, SubscriptionTier.STANDARD),
            establishment("Хачапурная", City.MINSK, "53.934200", "27.651300", "ул. Сурганова, 57",
                new Category[] {Category.RESTAURANT}, new Cuisine[] {Cuisine.GEORGIAN}, PriceRange.MODERATE,
                new Feature[] {Feature.PET_FRIENDLY, Feature.TERRACE}, "11:00", "23:00",
                null, 0, SubscriptionTier.FREE),
            establishment("Пекарня Хлебная", City.MINSK, "53.870400", "27.498800", "ул. Притыцкого, 29",
                new Category[] {Category.BAKERY, Category.CONFECTIONERY}, new Cuisine[] {Cuisine.NATIONAL},
                PriceRange.BUDGET, new Feature[] {Feature.KIDS_ZONE}, "07:00", "21:00",
                "4.7", 23, SubscriptionTier.FREE),
            establishment("Драйв 24", City.MINSK, "53.853000", "27.676400", "ул. Уручская, 21",
                new Category[] {Category.FAST_FOOD}, new Cuisine[] {Cuisine.AMERICAN}, PriceRange.BUDGET,
                new Feature[] {Feature.PARKING, Feature.DELIVERY}, null, null,
                "3.9", 230, SubscriptionTier.BASIC, true),
            establishment("Старый Гродно", City.GRODNO, "53.677800", "23.829500", "ул. Советская, 31",
                new Category[] {Category.RESTAURANT, Category.PUB}, new Cuisine[] {Cuisine.NATIONAL}, PriceRange.MODERATE,
                new Feature[] {Feature.BANQUET, Feature.TERRACE}, "12:00", "00:00",
                "4.4", 150, SubscriptionTier.PREMIUM)
        );
    }

    private static Establishment establishment(String name, City city, String lat, String lng, String address,
            Category[] categories, Cuisine[] cuisines, PriceRange priceRange, Feature[] features,
            String opensAt, String closesAt, String rating, int reviewCount, SubscriptionTier tier) {
        return establishment(name, city, lat, lng, address, categories, cuisines, priceRange, features,
            opensAt, closesAt, rating, reviewCount, tier, false);
    }

    private static Establishment establishment(String name, City city, String lat, String lng, String address,
            Category[] categories, Cuisine[] cuisines, PriceRange priceRange, Feature[] features,
            String opensAt, String closesAt, String rating, int reviewCount, SubscriptionTier tier,
            boolean open24Hours) {
        Establishment establishment = new Establishment(name, city, new BigDecimal(lat), new BigDecimal(lng));
        establishment.setAddress(address);
        establishment.setCategories(labels(categories));
        establishment.setCuisines(labels(cuisines));
        establishment.setFeatures(labels(features));
        establishment.setPriceRange(priceRange.getLabel());
        establishment.setOpensAt(opensAt == null ? null : LocalTime.parse(opensAt));
        establishment.setClosesAt(closesAt == null ? null : LocalTime.parse(closesAt));
        establishment.setOpen24Hours(open24Hours);
        establishment.setAverageRating(rating == null ? null : new BigDecimal(rating));
        establishment.setReviewCount(reviewCount);
        establishment.setSubscriptionTier(tier);
        establishment.setStatus(EstablishmentStatus.ACTIVE);
        return establishment;
    }

    private static String[] labels(LabeledValue[] values) {
        String[] labels = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            labels[i] = values[i].getLabel();
        }
        return labels;
    }
}
