package com.jay.forecast.controller;

import com.jay.forecast.TestFixtures;
import com.jay.forecast.config.ForecastConfig;
import com.jay.forecast.engine.ForecastOutcome;
import com.jay.forecast.engine.ForecastService;
import com.jay.forecast.exception.InsufficientHistoryException;
import com.jay.forecast.layer8_report.ForecastReportGenerator;
import com.jay.forecast.model.ForecastResult;
import com.jay.forecast.model.enums.AssumptionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ForecastControllerTest {

    private ForecastService service;
    private MockMvc mvc;
    private ForecastResult sampleResult;

    @BeforeEach
    void setUp() {
        ForecastConfig config = ForecastConfig.fromClasspath("forecast-test.yaml");
        service = mock(ForecastService.class);
        mvc = MockMvcBuilders
            .standaloneSetup(new ForecastController(config, service, new ForecastReportGenerator()))
            .build();
        sampleResult = TestFixtures.engine().run(TestFixtures.context(TestFixtures.sampleCompany().build()));
    }

    @Test
    void testListsCompanies() throws Exception {
        mvc.perform(get("/api/companies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].key").value("SampleCo"))
            .andExpect(jsonPath("$[0].ticker").value("SMPL"))
            .andExpect(jsonPath("$[1].baseYear").value(2022));
    }

    @Test
    void testForecastAsJson() throws Exception {
        when(service.forecast("SampleCo", null, null)).thenReturn(sampleResult);

        mvc.perform(get("/api/forecast/SampleCo"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.companyKey").value("SampleCo"))
            .andExpect(jsonPath("$.baseYear").value(2023))
            .andExpect(jsonPath("$.balanced").value(true))
            .andExpect(jsonPath("$.periods.length()").value(3))
            .andExpect(jsonPath("$.periods[0].year").value(2024));
    }

    @Test
    void testQueryParametersArePassedThrough() throws Exception {
        when(service.forecast("SampleCo", 2022, 1)).thenReturn(sampleResult);

        mvc.perform(get("/api/forecast/SampleCo").param("baseYear", "2022").param("years", "1"))
            .andExpect(status().isOk());

        verify(service).forecast("SampleCo", 2022, 1);
    }

    @Test
    void testTextReport() throws Exception {
        when(service.forecast("SampleCo", null, null)).thenReturn(sampleResult);

        mvc.perform(get("/api/forecast/SampleCo/report"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
            .andExpect(content().string(containsString("INCOME STATEMENT")));
    }

    @Test
    void testUnknownCompanyIsNotFound() throws Exception {
        mvc.perform(get("/api/forecast/Nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value(containsString("Nope")));
        verifyNoInteractions(service);
    }

    @Test
    void testForecastFailureIsUnprocessable() throws Exception {
        when(service.forecast("SampleCo", null, null))
            .thenThrow(new InsufficientHistoryException(AssumptionKey.REVENUE_GROWTH, 2, 1));

        mvc.perform(get("/api/forecast/SampleCo"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value(containsString("revenue_growth")));
    }

    @Test
    void testBatchStatus() throws Exception {
        when(service.forecastAll()).thenReturn(List.of(
            ForecastOutcome.success("SampleCo", sampleResult),
            ForecastOutcome.failure("IncompleteCo", "Missing balance sheet.csv")));

        mvc.perform(get("/api/forecast/all"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].status").value("OK"))
            .andExpect(jsonPath("$[0].balanced").value(true))
            .andExpect(jsonPath("$[1].status").value("FAILED"))
            .andExpect(jsonPath("$[1].error").value("Missing balance sheet.csv"));
    }
}
