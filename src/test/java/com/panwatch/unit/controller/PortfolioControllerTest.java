package com.panwatch.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.panwatch.api.controller.PortfolioController;
import com.panwatch.api.dto.request.AccountRequest;
import com.panwatch.api.dto.request.PositionRequest;
import com.panwatch.config.ApiResponseAdvice;
import com.panwatch.domain.enums.TradingStyle;
import com.panwatch.domain.model.Account;
import com.panwatch.domain.model.Holding;
import com.panwatch.exception.BusinessException;
import com.panwatch.exception.ErrorCode;
import com.panwatch.exception.GlobalExceptionHandler;
import com.panwatch.service.PortfolioService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the PortfolioController.
 */
@ExtendWith(MockitoExtension.class)
class PortfolioControllerTest {

    private MockMvc mockMvc;

    @Mock
    private PortfolioService portfolioService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PortfolioController(portfolioService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Holding holding() {
        return Holding.builder()
                .positionId(5L)
                .accountId(1L)
                .accountName("主账户")
                .instrumentId(7L)
                .symbol("600519")
                .instrumentName("贵州茅台")
                .costPrice(new BigDecimal("1500.00"))
                .quantity(200)
                .tradingStyle(TradingStyle.LONG)
                .build();
    }

    @Test
    @DisplayName("POST /api/accounts creates an account")
    void createAccount() throws Exception {
        when(portfolioService.createAccount(any(AccountRequest.class))).thenReturn(Account.builder()
                .id(1L).name("主账户").availableFunds(new BigDecimal("50000.00")).enabled(true).build());

        mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"主账户","availableFunds":50000}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value(1))
                .andExpect(jsonPath("$.data.enabled").value(true));
    }

    @Test
    @DisplayName("PUT /api/accounts/{id} with negative funds fails validation")
    void negativeFundsRejected() throws Exception {
        mockMvc.perform(put("/api/accounts/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"availableFunds":-1}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("DELETE /api/accounts/{id} deletes the account")
    void deleteAccount() throws Exception {
        mockMvc.perform(delete("/api/accounts/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Account deleted"));

        verify(portfolioService).deleteAccount(1L);
    }

    @Test
    @DisplayName("GET /api/positions passes the filters through")
    void listPositionsByAccount() throws Exception {
        when(portfolioService.getPositions(1L, null)).thenReturn(List.of(holding()));

        mockMvc.perform(get("/api/positions").param("accountId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].accountName").value("主账户"))
                .andExpect(jsonPath("$.data[0].symbol").value("600519"))
                .andExpect(jsonPath("$.data[0].tradingStyle").value("LONG"));
    }

    @Test
    @DisplayName("POST /api/positions opens a position")
    void createPosition() throws Exception {
        when(portfolioService.createPosition(any(PositionRequest.class))).thenReturn(holding());

        mockMvc.perform(post("/api/positions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"accountId":1,"instrumentId":7,"costPrice":1500,"quantity":200,"tradingStyle":"LONG"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.positionId").value(5));

        ArgumentCaptor<PositionRequest> request = ArgumentCaptor.forClass(PositionRequest.class);
        verify(portfolioService).createPosition(request.capture());
        assertThat(request.getValue().getCostPrice()).isEqualByComparingTo("1500");
        assertThat(request.getValue().getTradingStyle()).isEqualTo(TradingStyle.LONG);
    }

    @Test
    @DisplayName("POST /api/positions for an instrument already held in the account is 409")
    void duplicatePositionIsConflict() throws Exception {
        when(portfolioService.createPosition(any(PositionRequest.class))).thenThrow(new BusinessException(
                ErrorCode.CONFLICT, "Account already holds this instrument", Map.of("accountId", 1L)));

        mockMvc.perform(post("/api/positions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"accountId":1,"instrumentId":7,"costPrice":1500,"quantity":200}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("CONFLICT"));
    }

    @Test
    @DisplayName("PUT /api/positions/{id} updates the position")
    void updatePosition() throws Exception {
        when(portfolioService.updatePosition(eq(5L), any(PositionRequest.class))).thenReturn(holding());

        mockMvc.perform(put("/api/positions/5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"quantity":300}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<PositionRequest> request = ArgumentCaptor.forClass(PositionRequest.class);
        verify(portfolioService).updatePosition(eq(5L), request.capture());
        assertThat(request.getValue().getQuantity()).isEqualTo(300);
        assertThat(request.getValue().getCostPrice()).isNull();
    }
}
