package com.market.anomaly.controller;

import com.market.anomaly.exception.NotFoundException;
import com.market.anomaly.model.AggregatedPricePoint;
import com.market.anomaly.model.Granularity;
import com.market.anomaly.model.PriceHistory;
import com.market.anomaly.service.MarketQueryFacade;
import com.market.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PriceController.class)
class PriceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MarketQueryFacade facade;

    @Test
    void getPriceHistory_defaultsToAutoAggregation() throws Exception {
        Instant bucket = Instant.parse("2024-01-15T10:00:00Z");
        when(facade.priceHistory("btc-usd", "2024-01-01T00:00:00Z", "2024-01-15T00:00:00Z", "auto"))
                .thenReturn(new PriceHistory("BTC-USD", Granularity.ONE_HOUR, List.of(
                        AggregatedPricePoint.builder().bucketStart(bucket).symbol("BTC-USD").price(42000.5).build())));

        mockMvc.perform(get("/api/v1/prices/btc-usd")
                        .param("startDate", "2024-01-01T00:00:00Z")
                        .param("endDate", "2024-01-15T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.symbol").value("BTC-USD"))
                .andExpect(jsonPath("$.granularity").value("1h"))
                .andExpect(jsonPath("$.data[0].bucketStart").value("2024-01-15T10:00:00Z"))
                .andExpect(jsonPath("$.data[0].price").value(42000.5));
    }

    @Test
    void getLatestPrice_success() throws Exception {
        when(facade.latestPrice("ETH-USD")).thenReturn(
                TestDataFactory.createPriceSample("ETH-USD", Instant.parse("2024-01-15T10:01:00Z"), 2500.0, 12.5));

        mockMvc.perform(get("/api/v1/prices/ETH-USD/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(2500.0))
                .andExpect(jsonPath("$.volume").value(12.5));
    }

    @Test
    void getLatestPrice_noData_returns404() throws Exception {
        when(facade.latestPrice("PEPE-USD")).thenThrow(new NotFoundException("No price data found for symbol PEPE-USD"));

        mockMvc.perform(get("/api/v1/prices/PEPE-USD/latest"))
                .andExpect(status().isNotFound());
    }
}
