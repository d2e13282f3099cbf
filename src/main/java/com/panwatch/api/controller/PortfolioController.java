package com.panwatch.api.controller;

import com.panwatch.api.dto.request.AccountRequest;
import com.panwatch.api.dto.request.PositionRequest;
import com.panwatch.domain.model.Account;
import com.panwatch.domain.model.Holding;
import com.panwatch.service.PortfolioService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for brokerage accounts and positions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET    /api/accounts} -- list accounts</li>
 *   <li>{@code POST   /api/accounts} -- add an account</li>
 *   <li>{@code PUT    /api/accounts/{id}} -- update an account</li>
 *   <li>{@code DELETE /api/accounts/{id}} -- delete with its positions</li>
 *   <li>{@code GET    /api/positions?accountId=&instrumentId=} -- list positions</li>
 *   <li>{@code POST   /api/positions} -- open a position</li>
 *   <li>{@code PUT    /api/positions/{id}} -- update cost, quantity or style</li>
 *   <li>{@code DELETE /api/positions/{id}} -- close a position</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class PortfolioController {

    private final PortfolioService portfolioService;

    public PortfolioController(PortfolioService portfolioService) {
        this.portfolioService = portfolioService;
    }

    @GetMapping("/accounts")
    public List<Account> getAccounts() {
        return portfolioService.getAccounts();
    }

    @PostMapping("/accounts")
    @ResponseStatus(HttpStatus.CREATED)
    public Account createAccount(@RequestBody @Valid AccountRequest request) {
        return portfolioService.createAccount(request);
    }

    @PutMapping("/accounts/{id}")
    public Account updateAccount(@PathVariable Long id, @RequestBody @Valid AccountRequest request) {
        return portfolioService.updateAccount(id, request);
    }

    @DeleteMapping("/accounts/{id}")
    public Map<String, String> deleteAccount(@PathVariable Long id) {
        portfolioService.deleteAccount(id);
        return Map.of("message", "Account deleted");
    }

    @GetMapping("/positions")
    public List<Holding> getPositions(
            @RequestParam(required = false) Long accountId, @RequestParam(required = false) Long instrumentId) {
        return portfolioService.getPositions(accountId, instrumentId);
    }

    @PostMapping("/positions")
    @ResponseStatus(HttpStatus.CREATED)
    public Holding createPosition(@RequestBody @Valid PositionRequest request) {
        return portfolioService.createPosition(request);
    }

    @PutMapping("/positions/{id}")
    public Holding updatePosition(@PathVariable Long id, @RequestBody @Valid PositionRequest request) {
        return portfolioService.updatePosition(id, request);
    }

    @DeleteMapping("/positions/{id}")
    public Map<String, String> deletePosition(@PathVariable Long id) {
        portfolioService.deletePosition(id);
        return Map.of("message", "Position deleted");
    }
}
