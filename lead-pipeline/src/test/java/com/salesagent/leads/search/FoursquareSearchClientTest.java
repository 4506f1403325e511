package com.salesagent.leads.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.salesagent.leads.config.LeadPipelineProperties;
import com.salesagent.leads.model.FoursquarePlace;
import com.salesagent.leads.model.RawRecord;
import com.salesagent.leads.model.SearchRequest;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

@ExtendWith(MockitoExtension.class)
class FoursquareSearchClientTest {

    @Mock
    private RestTemplate restTemplate;

    private LeadPipelineProperties properties;
    private FoursquareSearchClient client;

    @BeforeEach
    void setUp() {
        properties = new LeadPipelineProperties();
        properties.getSearch().getFoursquare().setApiKey("fsq-key");
        client = new FoursquareSearchClient(restTemplate, properties);
    }

    @Test
    void mapsPlaceToRawRecord() {
        RawRecord record = client.toRawRecord(place());

        assertThat(record.getName()).isEqualTo("Blue Door Bakery");
        assertThat(record.getAddress()).isEqualTo("12 High St, Austin, TX, US");
        assertThat(record.getPhone()).isEqualTo("(512) 555-0100");
        assertThat(record.getWebsite()).isEqualTo("https://bluedoor.example");
        assertThat(record.getCategory()).isEqualTo("Bakery");
        assertThat(record.getRating()).isEqualTo("4.3");
        assertThat(record.getSourceProvider()).isEqualTo(FoursquareSearchClient.SOURCE_TAG);
        assertThat(record.getExtras()).containsEntry("fsq_place_id", "abc123").containsEntry("distance", "250");
    }

    @Test
    void contactBlockFillsMissingTopLevelFields() {
        FoursquarePlace place = place();
        place.setTel(null);
        FoursquarePlace.Contact contact = new FoursquarePlace.Contact();
        contact.setPhone("512-555-0199");
        contact.setEmail("hello@bluedoor.example");
        place.setContact(contact);

        RawRecord record = client.toRawRecord(place);

        assertThat(record.getPhone()).isEqualTo("512-555-0199");
        assertThat(record.getEmail()).isEqualTo("hello@bluedoor.example");
    }

    @Test
    void searchSendsAuthAndClampsLimit() {
        FoursquarePlace.SearchResponse body = new FoursquarePlace.SearchResponse();
        body.setResults(List.of(place()));
        when(restTemplate.exchange(anyString(), eq(HttpMethod.GET), any(HttpEntity.class),
            eq(FoursquarePlace.SearchResponse.class))).thenReturn(ResponseEntity.ok(body));

        List<RawRecord> records = client.search(new SearchRequest("bakery", "Austin, TX", 2000, 500));

        assertThat(records).hasSize(1);
        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<HttpEntity> entity = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(url.capture(), eq(HttpMethod.GET), entity.capture(),
            eq(FoursquarePlace.SearchResponse.class));
        assertThat(url.getValue()).contains("/places/search").contains("limit=50").contains("radius=2000");
        assertThat(entity.getValue().getHeaders().getFirst("Authorization")).isEqualTo("Bearer fsq-key");
        assertThat(entity.getValue().getHeaders().getFirst("X-Places-Api-Version")).isNotBlank();
    }

    @Test
    void notFoundMeansNoResults() {
        when(restTemplate.exchange(anyString(), eq(HttpMethod.GET), any(HttpEntity.class),
            eq(FoursquarePlace.SearchResponse.class)))
            .thenThrow(HttpClientErrorException.create(HttpStatus.NOT_FOUND, "Not Found", null, null, null));

        assertThat(client.search(new SearchRequest("bakery", "Nowhere", 1000, 10))).isEmpty();
    }

    @Test
    void disabledWithoutApiKey() {
        properties.getSearch().getFoursquare().setApiKey(" ");

        assertThat(client.isEnabled()).isFalse();
    }

    private FoursquarePlace place() {
        FoursquarePlace place = new FoursquarePlace();
        place.setFsqPlaceId("abc123");
        place.setName("Blue Door Bakery");
        FoursquarePlace.Location location = new FoursquarePlace.Location();
        location.setAddress("12 High St");
        location.setLocality("Austin");
        location.setRegion("TX");
        location.setCountry("US");
        place.setLocation(location);
        FoursquarePlace.Category category = new FoursquarePlace.Category();
        category.setName("Bakery");
        place.setCategories(List.of(category));
        place.setTel("(512) 555-0100");
        place.setWebsite("https://bluedoor.example");
        place.setRating(8.6);
        place.setDistance(250);
        return place;
    }
}
