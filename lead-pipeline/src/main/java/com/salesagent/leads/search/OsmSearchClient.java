package com.salesagent.leads.search;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.OsmElement;
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
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds businesses around a city using OpenStreetMap: Nominatim to geocode the
 * location, then an Overpass query for named amenity and shop nodes within the radius.
 *
 * Both services ask for an identifying User-Agent and are shared public infrastructure,
 * so one geocode and one Overpass call per search.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OsmSearchClient implements SearchProducer {

    public static final String SOURCE_TAG = "cluster_search";

    private final RestTemplate restTemplate;
    private final LeadPipelineProperties properties;

    @Override
    public String sourceTag() {
        return SOURCE_TAG;
    }

    @Override
    public boolean isEnabled() {
        return properties.getSearch().getOsm().isEnabled();
    }

    @Override
    @Retry(name = "searchProvider")
    public List<RawRecord> search(SearchRequest request) {
        OsmElement.GeocodeResult centre = geocode(request.location());
        if (centre == null) {
            log.warn("OSM could not geocode '{}'", request.location());
            return Collections.emptyList();
        }

        List<OsmElement> elements = overpass(Double.parseDouble(centre.getLat()),
                Double.parseDouble(centre.getLon()), request.radiusMeters());

        List<RawRecord> records = new ArrayList<>();
        for (OsmElement element : elements) {
            String name = element.tag("name");
            if (name == null || name.isBlank()) continue;
            records.add(toRawRecord(element, request.location()));
            if (records.size() >= request.limit()) break;
        }
        log.info("OSM returned {} named place(s) of {} element(s) around {}",
                records.size(), elements.size(), request.location());
        return records;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private OsmElement.GeocodeResult geocode(String location) {
        LeadPipelineProperties.Search.Osm config = properties.getSearch().getOsm();
        String url = UriComponentsBuilder
                .fromHttpUrl(config.getNominatimUrl() + "/search")
                .queryParam("q", location)
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .queryParam("addressdetails", 0)
                .toUriString();

        ResponseEntity<OsmElement.GeocodeResult[]> response = restTemplate.exchange(
                url, HttpMethod.GET, new HttpEntity<>(headers(MediaType.APPLICATION_JSON)),
                OsmElement.GeocodeResult[].class);
        OsmElement.GeocodeResult[] body = response.getBody();
        if (body == null || body.length == 0 || body[0].getLat() == null || body[0].getLon() == null) {
            return null;
        }
        return body[0];
    }

    private List<OsmElement> overpass(double lat, double lon, int radiusMeters) {
        String query = String.format(Locale.ROOT, """
                [out:json][timeout:25];
                (
                  node(around:%d,%f,%f)["amenity"];
                  node(around:%d,%f,%f)["shop"];
                );
                out body;
                """, radiusMeters, lat, lon, radiusMeters, lat, lon);

        ResponseEntity<OsmElement.OverpassResponse> response = restTemplate.exchange(
                properties.getSearch().getOsm().getOverpassUrl(), HttpMethod.POST,
                new HttpEntity<>(query, headers(MediaType.TEXT_PLAIN)),
                OsmElement.OverpassResponse.class);
        OsmElement.OverpassResponse body = response.getBody();
        return body == null || body.getElements() == null ? Collections.emptyList() : body.getElements();
    }

    private HttpHeaders headers(MediaType contentType) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, properties.getSearch().getOsm().getUserAgent());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (contentType != MediaType.APPLICATION_JSON) {
            headers.setContentType(contentType);
        }
        return headers;
    }

    RawRecord toRawRecord(OsmElement element, String cityFallback) {
        String city = element.tag("addr:city") != null ? element.tag("addr:city") : cityFallback;
        String address = Stream.of(
                        element.tag("addr:housenumber"),
                        element.tag("addr:street"),
                        city,
                        element.tag("addr:state"),
                        element.tag("addr:postcode"),
                        element.tag("addr:country"))
                .filter(Objects::nonNull)
                .filter(s -> !s.isBlank())
                .collect(Collectors.joining(", "));

        RawRecord record = RawRecord.builder()
                .name(element.tag("name"))
                .address(address.isEmpty() ? null : address)
                .phone(firstNonBlank(element.tag("phone"), element.tag("contact:phone")))
                .email(firstNonBlank(element.tag("email"), element.tag("contact:email")))
                .website(firstNonBlank(element.tag("website"), element.tag("contact:website")))
                .category(firstNonBlank(element.tag("amenity"), element.tag("shop")))
                .sourceProvider(SOURCE_TAG)
                .build();
        if (element.getId() != null) {
            record.getExtras().put("osm_id", String.valueOf(element.getId()));
        }
        if (element.getLat() != null && element.getLon() != null) {
            record.getExtras().put("lat", String.valueOf(element.getLat()));
            record.getExtras().put("lon", String.valueOf(element.getLon()));
        }
        return record;
    }

    private String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        return b;
    }
}
