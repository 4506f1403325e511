package com.salesagent.leads.search;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.FoursquarePlace;
import com.salesagent.leads.model.RawRecord;
import com.salesagent.leads.model.SearchRequest;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Thin client over the Foursquare Places search API.
 *
 * A 429 or 5xx is rethrown so the "searchProvider" Resilience4j retry can back off.
 * A 404 means nothing matched and is treated as an empty result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FoursquareSearchClient implements SearchProducer {

    public static final String SOURCE_TAG = "map_search";

    private static final int MAX_RADIUS_METERS = 100_000;

    private final RestTemplate restTemplate;
    private final LeadPipelineProperties properties;

    @Override
    public String sourceTag() {
        return SOURCE_TAG;
    }

    @Override
    public boolean isEnabled() {
        LeadPipelineProperties.Search.Foursquare config = properties.getSearch().getFoursquare();
        return config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    @Retry(name = "searchProvider")
    public List<RawRecord> search(SearchRequest request) {
        LeadPipelineProperties.Search.Foursquare config = properties.getSearch().getFoursquare();
        String url = UriComponentsBuilder
                .fromHttpUrl(config.getBaseUrl() + "/places/search")
                .queryParam("query", request.query())
                .queryParam("near", request.location())
                .queryParam("radius", Math.min(request.radiusMeters(), MAX_RADIUS_METERS))
                .queryParam("limit", Math.min(request.limit(), config.getMaxLimit()))
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(config.getApiKey());
        headers.set("X-Places-Api-Version", config.getApiVersion());

        log.debug("Calling Foursquare: {}", url);
        try {
            ResponseEntity<FoursquarePlace.SearchResponse> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), FoursquarePlace.SearchResponse.class);
            FoursquarePlace.SearchResponse body = response.getBody();
            if (body == null || body.getResults() == null) {
                return Collections.emptyList();
            }
            List<RawRecord> records = new ArrayList<>();
            for (FoursquarePlace place : body.getResults()) {
                records.add(toRawRecord(place));
            }
            log.info("Foursquare returned {} place(s) for '{}' near {}", records.size(), request.query(), request.location());
            return records;

        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No Foursquare results (404) for URL: {}", url);
            return Collections.emptyList();

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Foursquare");
            throw e;
        }
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    RawRecord toRawRecord(FoursquarePlace place) {
        FoursquarePlace.Contact contact = place.getContact();
        RawRecord record = RawRecord.builder()
                .name(place.getName())
                .address(formatAddress(place.getLocation()))
                .phone(firstNonBlank(place.getTel(), contact == null ? null : contact.getPhone()))
                .email(firstNonBlank(place.getEmail(), contact == null ? null : contact.getEmail()))
                .website(firstNonBlank(place.getWebsite(), contact == null ? null : contact.getWebsite()))
                .category(place.getCategories() == null || place.getCategories().isEmpty()
                        ? null : place.getCategories().get(0).getName())
                // Foursquare rates out of 10
                .rating(place.getRating() == null ? null : String.valueOf(place.getRating() / 2.0))
                .sourceProvider(SOURCE_TAG)
                .build();
        if (place.getFsqPlaceId() != null) {
            record.getExtras().put("fsq_place_id", place.getFsqPlaceId());
        }
        if (place.getDistance() != null) {
            record.getExtras().put("distance", String.valueOf(place.getDistance()));
        }
        return record;
    }

    private String formatAddress(FoursquarePlace.Location location) {
        if (location == null) return null;
        String joined = Stream.of(location.getAddress(), location.getLocality(), location.getRegion(), location.getCountry())
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? location.getFormattedAddress() : joined;
    }

    private String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        return b;
    }
}
