package dev.whispr.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.whispr.catalog.ProfessorView;
import dev.whispr.config.GlobalExceptionHandler;
import dev.whispr.search.EntityType;
import dev.whispr.search.MultiEntitySearchCoordinator;
import dev.whispr.search.ScoredEntity;
import dev.whispr.search.SearchAbortedException;
import dev.whispr.search.SearchQuery;
import dev.whispr.search.SearchResponse;
import dev.whispr.search.SortField;
import dev.whispr.search.SortOrder;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
@Import({WebConfig.class, GlobalExceptionHandler.class})
class SearchControllerTest {

  private static final Instant CREATED = Instant.parse("2024-03-01T09:00:00Z");

  @Autowired MockMvc mockMvc;

  @MockitoBean MultiEntitySearchCoordinator coordinator;

  private static SearchResponse oneProfessor(String query, boolean deep) {
    ProfessorView smith =
        new ProfessorView(
            UUID.randomUUID(), "John Smith", "Vision Lab", null, 4, new BigDecimal("4.25"),
            CREATED, null);
    return new SearchResponse(
        1,
        List.of(new ScoredEntity(EntityType.PROFESSOR, 100.0, smith, CREATED, null)),
        query,
        deep);
  }

  @Test
  void getBindsSnakeCaseParametersIntoTheQuery() throws Exception {
    UUID courseId = UUID.randomUUID();
    when(coordinator.search(any())).thenReturn(oneProfessor("smith", true));

    mockMvc
        .perform(
            get("/api/v1/search")
                .param("query", "smith")
                .param("deep", "true")
                .param("entity_types", "professor,course_instructor")
                .param("course_id", courseId.toString())
                .param("min_rating", "2")
                .param("sort_by", "created_at")
                .param("sort_order", "asc")
                .param("skip", "1")
                .param("limit", "5"))
        .andExpect(status().isOk());

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(coordinator).search(captor.capture());
    SearchQuery query = captor.getValue();
    assertThat(query.query()).isEqualTo("smith");
    assertThat(query.deep()).isTrue();
    assertThat(query.entityTypes())
        .containsExactlyInAnyOrder(EntityType.PROFESSOR, EntityType.COURSE_INSTRUCTOR);
    assertThat(query.courseId()).isEqualTo(courseId);
    assertThat(query.minRating()).isEqualTo(2);
    assertThat(query.maxRating()).isNull();
    assertThat(query.sortBy()).isEqualTo(SortField.CREATED_AT);
    assertThat(query.sortOrder()).isEqualTo(SortOrder.ASC);
    assertThat(query.skip()).isEqualTo(1);
    assertThat(query.limit()).isEqualTo(5);
  }

  @Test
  void getAppliesDefaults() throws Exception {
    when(coordinator.search(any())).thenReturn(oneProfessor("smith", false));

    mockMvc.perform(get("/api/v1/search").param("query", "smith")).andExpect(status().isOk());

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(coordinator).search(captor.capture());
    assertThat(captor.getValue()).isEqualTo(new SearchQuery("smith"));
  }

  @Test
  void rendersSnakeCaseResponseWithoutSortKeys() throws Exception {
    when(coordinator.search(any())).thenReturn(oneProfessor("smith", false));

    mockMvc
        .perform(get("/api/v1/search").param("query", "smith"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.query").value("smith"))
        .andExpect(jsonPath("$.deep").value(false))
        .andExpect(jsonPath("$.results[0].entity_type").value("professor"))
        .andExpect(jsonPath("$.results[0].relevance_score").value(100.0))
        .andExpect(jsonPath("$.results[0].data.name").value("John Smith"))
        .andExpect(jsonPath("$.results[0].data.review_count").value(4))
        .andExpect(jsonPath("$.results[0].created_at").doesNotExist());
  }

  @Test
  void postAcceptsJsonBody() throws Exception {
    when(coordinator.search(any())).thenReturn(oneProfessor("smith", true));

    mockMvc
        .perform(
            post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"query": "smith", "deep": true, "entity_types": ["professor"],
                     "max_rating": 4, "sort_by": "updated_at", "limit": 10}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deep").value(true));

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(coordinator).search(captor.capture());
    SearchQuery query = captor.getValue();
    assertThat(query.entityTypes()).containsExactly(EntityType.PROFESSOR);
    assertThat(query.maxRating()).isEqualTo(4);
    assertThat(query.sortBy()).isEqualTo(SortField.UPDATED_AT);
    assertThat(query.sortOrder()).isEqualTo(SortOrder.DESC);
    assertThat(query.skip()).isZero();
    assertThat(query.limit()).isEqualTo(10);
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/v1/search").param("query", "  "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail").value("Search query cannot be empty"));

    verify(coordinator, never()).search(any());
  }

  @Test
  void missingQueryIsBadRequest() throws Exception {
    mockMvc.perform(get("/api/v1/search")).andExpect(status().isBadRequest());
  }

  @Test
  void limitOutOfRangeIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/v1/search").param("query", "smith").param("limit", "101"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownEntityTypeIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/v1/search").param("query", "smith").param("entity_types", "planet"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownSortFieldInBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"smith\", \"sort_by\": \"popularity\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void punctuationOnlyQueryRejectedByCoordinatorIsBadRequest() throws Exception {
    when(coordinator.search(any()))
        .thenThrow(new IllegalArgumentException("Search query cannot be empty"));

    mockMvc
        .perform(get("/api/v1/search").param("query", "?!"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void timeoutIsGatewayTimeout() throws Exception {
    when(coordinator.search(any())).thenThrow(new SearchAbortedException("Search timed out"));

    mockMvc
        .perform(get("/api/v1/search").param("query", "smith"))
        .andExpect(status().isGatewayTimeout());
  }

  @Test
  void storeFailureIsServiceUnavailable() throws Exception {
    when(coordinator.search(any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get("/api/v1/search").param("query", "smith"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.detail").value("Data store temporarily unavailable"));
  }
}
