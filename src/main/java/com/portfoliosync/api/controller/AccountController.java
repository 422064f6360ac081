package com.portfoliosync.api.controller;

import com.portfoliosync.api.dto.request.CreateAccountRequest;
import com.portfoliosync.api.dto.request.UpdateAccountRequest;
import com.portfoliosync.api.dto.response.AccountResponse;
import com.portfoliosync.mapper.AccountMapper;
import com.portfoliosync.service.AccountService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
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
 * REST API for Kite accounts and the manual login flow.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET  /api/accounts} -- list accounts</li>
 *   <li>{@code POST /api/accounts} -- register an account</li>
 *   <li>{@code GET  /api/accounts/{id}} -- one account</li>
 *   <li>{@code PUT  /api/accounts/{id}} -- edit name, credentials or request token</li>
 *   <li>{@code DELETE /api/accounts/{id}} -- remove the account and its stored data</li>
 *   <li>{@code GET  /api/accounts/{id}/login-url} -- Kite OAuth login URL for the account</li>
 *   <li>{@code GET  /api/accounts/capture-token/{accountName}} -- OAuth redirect target</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    private final AccountService accountService;

    private final AccountMapper accountMapper = Mappers.getMapper(AccountMapper.class);

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public List<AccountResponse> getAccounts() {
        return accountMapper.toResponseList(accountService.getAccounts());
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AccountResponse createAccount(@RequestBody @Valid CreateAccountRequest request) {
        return accountMapper.toResponse(accountService.createAccount(request));
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable Long id) {
        return accountMapper.toResponse(accountService.getAccount(id));
    }

    @PutMapping("/{id}")
    public AccountResponse updateAccount(@PathVariable Long id, @RequestBody @Valid UpdateAccountRequest request) {
        return accountMapper.toResponse(accountService.updateAccount(id, request));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAccount(@PathVariable Long id) {
        accountService.deleteAccount(id);
    }

    @GetMapping("/{id}/login-url")
    public Map<String, String> getLoginUrl(@PathVariable Long id) {
        return Map.of("loginUrl", accountService.getLoginUrl(id));
    }

    /** Kite redirects here after login with {@code request_token} and {@code status}. */
    @GetMapping("/capture-token/{accountName}")
    public AccountResponse captureToken(
            @PathVariable String accountName,
            @RequestParam(name = "request_token", required = false) String requestToken,
            @RequestParam(required = false) String status) {
        return accountMapper.toResponse(accountService.captureRequestToken(accountName, requestToken, status));
    }
}
