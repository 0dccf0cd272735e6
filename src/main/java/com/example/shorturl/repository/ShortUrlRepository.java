package com.example.shorturl.repository;

import com.example.shorturl.model.ShortUrl;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface ShortUrlRepository extends JpaRepository<ShortUrl, Long> {

    Optional<ShortUrl> findByShortCode(String shortCode);

    boolean existsByShortCode(String shortCode);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ShortUrl s SET s.accessCount = s.accessCount + 1, s.updatedAt = :now WHERE s.shortCode = :shortCode")
    int incrementAccessCount(@Param("shortCode") String shortCode, @Param("now") Instant now);
}
