package com.litscan.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.litscan.config.LitScanProperties;
import com.litscan.model.dto.CandidateRecord;
import com.litscan.model.dto.ExtractedFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAlexClientTest {

    private static final String WORK = """
            {"id":"https://openalex.org/W123",
             "doi":"https://doi.org/10.1000/ABC",
             "title":"Scanning Old Papers",
             "publication_year":2019,
             "type":"article",
             "relevance_score":12.5,
             "authorships":[
               {"author":{"display_name":"John Smith"}},
               {"author":{"display_name":null},"raw_author_name":"Jane Doe"},
               {"author":{"display_name":"李四"}},
               {"author":{"display_name":"Extra Person"}}],
             "primary_location":{"source":null},
             "host_venue":{"display_name":"Old Venue"},
             "biblio":{"volume":"7","issue":"2","first_page":"100","last_page":"110"}}
            """;

    private MockRestServiceServer server;
    private OpenAlexClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        LitScanProperties properties = new LitScanProperties();
        properties.getResolver().setInitialBackoffMillis(0L);
        client = new OpenAlexClient(new CatalogHttpExecutor(restTemplate, properties, new ObjectMapper()), properties);
    }

    @Test
    void toCandidate_shouldMapWorkFields() throws Exception {
        CandidateRecord record = OpenAlexClient.toCandidate(new ObjectMapper().readTree(WORK));

        assertThat(record.getDoi()).isEqualTo("10.1000/abc");
        assertThat(record.getUrl()).isEqualTo("https://doi.org/10.1000/ABC");
        assertThat(record.getAuthors()).isEqualTo("Smith, John; Doe, Jane; 李四");
        assertThat(record.getVenue()).isEqualTo("Old Venue");
        assertThat(record.getPages()).isEqualTo("100-110");
        assertThat(record.getYear()).isEqualTo(2019);
        assertThat(record.getScore()).isEqualTo(12.5);
        assertThat(record.getCatalog()).isEqualTo(OpenAlexClient.NAME);
    }

    @Test
    void lookupByDoi_shouldUseDoiPath() {
        server.expect(requestTo(startsWith("https://api.openalex.org/works/doi:10.1000/abc")))
                .andRespond(withSuccess(WORK, MediaType.APPLICATION_JSON));

        Optional<CandidateRecord> result = client.lookupByDoi("10.1000/abc");

        assertThat(result).map(CandidateRecord::getTitle).contains("Scanning Old Papers");
        server.verify();
    }

    @Test
    void search_shouldSendTitleAndYearFilter() {
        server.expect(requestTo(allOf(
                        startsWith("https://api.openalex.org/works?"),
                        containsString("filter=title.search%3AScanning%20Old%20Papers%2Cpublication_year%3A2019"),
                        containsString("per-page=5"))))
                .andRespond(withSuccess("{\"results\":[" + WORK + "]}", MediaType.APPLICATION_JSON));

        ExtractedFields fields = new ExtractedFields();
        fields.setTitle("Scanning Old Papers");
        fields.setYear(2019);
        List<CandidateRecord> candidates = client.search(fields);

        assertThat(candidates).hasSize(1);
        server.verify();
    }

    @Test
    void buildFilter_shouldStripFilterSyntax() {
        ExtractedFields fields = new ExtractedFields();
        fields.setTitle("Deep: \"Learning\", Fast");
        fields.setYear(2020);

        assertThat(OpenAlexClient.buildFilter(fields)).isEqualTo("title.search:Deep Learning Fast,publication_year:2020");
        assertThat(OpenAlexClient.buildFilter(new ExtractedFields())).isNull();
    }

    @Test
    void stripDoiPrefix_shouldLowerCaseBareDoi() {
        assertThat(OpenAlexClient.stripDoiPrefix("https://doi.org/10.1/XY")).isEqualTo("10.1/xy");
        assertThat(OpenAlexClient.stripDoiPrefix(null)).isNull();
    }

    @Test
    void search_shouldEncodePlusSignInTitleFilter() {
        server.expect(requestTo(containsString("filter=title.search%3AC%2B%2B%20Templates&")))
                .andRespond(withSuccess("{\"results\":[" + WORK + "]}", MediaType.APPLICATION_JSON));

        ExtractedFields fields = new ExtractedFields();
        fields.setTitle("C++ Templates");

        assertThat(client.search(fields)).hasSize(1);
        server.verify();
    }
}
