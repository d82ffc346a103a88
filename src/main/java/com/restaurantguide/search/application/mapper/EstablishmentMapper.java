package com.restaurantguide.search.application.mapper;

import com.restaurantguide.search.api.dto.EstablishmentDetailDto;
import com.restaurantguide.search.api.dto.MapMarkerDto;
import com.restaurantguide.search.api.dto.RankedEstablishmentDto;
import com.restaurantguide.search.domain.model.Establishment;
import com.restaurantguide.search.domain.model.RankedResult;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class EstablishmentMapper {

  private static final DateTimeFormatter HOURS_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  /**
   * Maps a ranked list-view row. Distance is rounded to whole meters.
   */
  public RankedEstablishmentDto toRankedDto(RankedResult result) {
    return new RankedEstablishmentDto(
        result.getId(),
        result.getName(),
        result.getLat(),
        result.getLng(),
        result.getCity(),
        result.getAddress(),
        result.getCategories(),
        result.getCuisines(),
        result.getPriceRange(),
        result.getAverageRating(),
        result.getReviewCount(),
        result.getSubscriptionTier() == null ? null : result.getSubscriptionTier().getLabel(),
        result.getPrimaryImageUrl(),
        result.getDistanceMeters() == null ? 0L : Math.round(result.getDistanceMeters()),
        result.getScore());
  }

  public MapMarkerDto toMarkerDto(RankedResult result) {
    return new MapMarkerDto(
        result.getId(),
        result.getName(),
        result.getLat(),
        result.getLng(),
        result.primaryCategory(),
        result.getAverageRating(),
        result.getScore());
  }

  /**
   * Maps a domain Establishment to its public detail view.
   *
   * @param establishment Domain model
   * @return DTO representation
   */
  public EstablishmentDetailDto toDetailDto(Establishment establishment) {
    return new EstablishmentDetailDto(
        establishment.getId(),
        establishment.getName(),
        establishment.getDescription(),
        establishment.getCity(),
        establishment.getAddress(),
        establishment.getLatitude(),
        establishment.getLongitude(),
        asList(establishment.getCategories()),
        asList(establishment.getCuisines()),
        asList(establishment.getFeatures()),
        establishment.getPriceRange(),
        formatTime(establishment.getOpensAt()),
        formatTime(establishment.getClosesAt()),
        establishment.isOpen24Hours(),
        establishment.getAverageRating(),
        establishment.getReviewCount(),
        establishment.getSubscriptionTier().getLabel(),
        establishment.getPrimaryImageUrl());
  }

  // ArrayList keeps the cached JSON type information deserializable
  private static List<String> asList(String[] values) {
    return values == null ? new ArrayList<>() : new ArrayList<>(Arrays.asList(values));
  }

  private static String formatTime(LocalTime time) {
    return time == null ? null : time.format(HOURS_FORMAT);
  }
}
