package com.panwatch.service;

import com.panwatch.api.dto.request.AccountRequest;
import com.panwatch.api.dto.request.PositionRequest;
import com.panwatch.domain.enums.TradingStyle;
import com.panwatch.domain.model.Account;
import com.panwatch.domain.model.Holding;
import com.panwatch.domain.model.Portfolio;
import com.panwatch.domain.model.Position;
import com.panwatch.entity.AccountEntity;
import com.panwatch.entity.InstrumentEntity;
import com.panwatch.entity.PositionEntity;
import com.panwatch.exception.BusinessException;
import com.panwatch.exception.ErrorCode;
import com.panwatch.exception.ResourceNotFoundException;
import com.panwatch.mapper.PortfolioMapper;
import com.panwatch.repository.jpa.AccountJpaRepository;
import com.panwatch.repository.jpa.InstrumentJpaRepository;
import com.panwatch.repository.jpa.PositionJpaRepository;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Brokerage accounts and the positions held in them.
 *
 * <p>An account holds at most one position per instrument. Deleting an account deletes its
 * positions; deleting an instrument does the same through {@link InstrumentService}. Agent runs
 * read holdings through {@link #loadPortfolio(Collection)}, which leaves disabled accounts out.
 */
@Service
public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private final AccountJpaRepository accountJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final InstrumentJpaRepository instrumentJpaRepository;
    private final PortfolioMapper portfolioMapper;

    public PortfolioService(
            AccountJpaRepository accountJpaRepository,
            PositionJpaRepository positionJpaRepository,
            InstrumentJpaRepository instrumentJpaRepository,
            PortfolioMapper portfolioMapper) {
        this.accountJpaRepository = accountJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.instrumentJpaRepository = instrumentJpaRepository;
        this.portfolioMapper = portfolioMapper;
    }

    // ---- accounts ----

    @Transactional(readOnly = true)
    public List<Account> getAccounts() {
        return portfolioMapper.toAccountList(accountJpaRepository.findAllByOrderByIdAsc());
    }

    @Transactional
    public Account createAccount(AccountRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Account name is required");
        }
        AccountEntity saved = accountJpaRepository.save(AccountEntity.builder()
                .name(request.getName().trim())
                .availableFunds(request.getAvailableFunds() == null ? BigDecimal.ZERO : request.getAvailableFunds())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build());
        log.info("Account created: id={}, name={}", saved.getId(), saved.getName());
        return portfolioMapper.toDomain(saved);
    }

    @Transactional
    public Account updateAccount(Long id, AccountRequest request) {
        AccountEntity entity = findAccount(id);
        if (request.getName() != null && !request.getName().isBlank()) {
            entity.setName(request.getName().trim());
        }
        if (request.getAvailableFunds() != null) {
            entity.setAvailableFunds(request.getAvailableFunds());
        }
        if (request.getEnabled() != null) {
            entity.setEnabled(request.getEnabled());
        }
        AccountEntity saved = accountJpaRepository.save(entity);
        log.info("Account updated: id={}, enabled={}", saved.getId(), saved.isEnabled());
        return portfolioMapper.toDomain(saved);
    }

    @Transactional
    public void deleteAccount(Long id) {
        findAccount(id);
        positionJpaRepository.deleteByAccountId(id);
        accountJpaRepository.deleteById(id);
        log.info("Account deleted with its positions: id={}", id);
    }

    // ---- positions ----

    /** Lists positions, optionally narrowed to one account and/or one instrument. */
    @Transactional(readOnly = true)
    public List<Holding> getPositions(Long accountId, Long instrumentId) {
        List<PositionEntity> positions;
        if (accountId != null && instrumentId != null) {
            positions = positionJpaRepository.findByAccountIdAndInstrumentId(accountId, instrumentId);
        } else if (accountId != null) {
            positions = positionJpaRepository.findByAccountId(accountId);
        } else if (instrumentId != null) {
            positions = positionJpaRepository.findByInstrumentId(instrumentId);
        } else {
            positions = positionJpaRepository.findAll();
        }
        return toHoldings(positions, accountJpaRepository.findAllById(
                positions.stream().map(PositionEntity::getAccountId).distinct().toList()));
    }

    /**
     * Opens a position.
     *
     * @throws ResourceNotFoundException if the account or instrument is unknown
     * @throws BusinessException with {@link ErrorCode#CONFLICT} if the account already holds the instrument
     */
    @Transactional
    public Holding createPosition(PositionRequest request) {
        if (request.getAccountId() == null || request.getInstrumentId() == null
                || request.getCostPrice() == null || request.getQuantity() == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR,
                    "accountId, instrumentId, costPrice and quantity are required");
        }
        AccountEntity account = findAccount(request.getAccountId());
        if (!instrumentJpaRepository.existsById(request.getInstrumentId())) {
            throw new ResourceNotFoundException("Instrument", request.getInstrumentId());
        }
        if (positionJpaRepository.existsByAccountIdAndInstrumentId(request.getAccountId(), request.getInstrumentId())) {
            throw new BusinessException(ErrorCode.CONFLICT,
                    "Account already holds this instrument",
                    Map.of("accountId", request.getAccountId(), "instrumentId", request.getInstrumentId()));
        }
        PositionEntity saved = positionJpaRepository.save(portfolioMapper.toEntity(Position.builder()
                .accountId(request.getAccountId())
                .instrumentId(request.getInstrumentId())
                .costPrice(request.getCostPrice())
                .quantity(request.getQuantity())
                .investedAmount(request.getInvestedAmount())
                .tradingStyle(request.getTradingStyle() == null ? TradingStyle.SWING : request.getTradingStyle())
                .build()));
        log.info("Position opened: id={}, account={}, instrument={}, qty={}",
                saved.getId(), saved.getAccountId(), saved.getInstrumentId(), saved.getQuantity());
        return toHoldings(List.of(saved), List.of(account)).get(0);
    }

    @Transactional
    public Holding updatePosition(Long id, PositionRequest request) {
        PositionEntity entity = findPosition(id);
        if (request.getCostPrice() != null) {
            entity.setCostPrice(request.getCostPrice());
        }
        if (request.getQuantity() != null) {
            entity.setQuantity(request.getQuantity());
        }
        if (request.getInvestedAmount() != null) {
            entity.setInvestedAmount(request.getInvestedAmount());
        }
        if (request.getTradingStyle() != null) {
            entity.setTradingStyle(request.getTradingStyle());
        }
        PositionEntity saved = positionJpaRepository.save(entity);
        log.info("Position updated: id={}, cost={}, qty={}", saved.getId(), saved.getCostPrice(), saved.getQuantity());
        return toHoldings(List.of(saved), List.of(findAccount(saved.getAccountId()))).get(0);
    }

    @Transactional
    public void deletePosition(Long id) {
        findPosition(id);
        positionJpaRepository.deleteById(id);
        log.info("Position deleted: id={}", id);
    }

    /** Holdings of enabled accounts in the given instruments; empty when none are held. */
    @Transactional(readOnly = true)
    public Portfolio loadPortfolio(Collection<Long> instrumentIds) {
        if (instrumentIds.isEmpty()) {
            return Portfolio.empty();
        }
        List<AccountEntity> accounts = accountJpaRepository.findByEnabledTrueOrderByIdAsc();
        if (accounts.isEmpty()) {
            return Portfolio.empty();
        }
        List<PositionEntity> positions = positionJpaRepository.findByAccountIdInAndInstrumentIdIn(
                accounts.stream().map(AccountEntity::getId).toList(), instrumentIds);
        return new Portfolio(toHoldings(positions, accounts));
    }

    private List<Holding> toHoldings(List<PositionEntity> positions, List<AccountEntity> accounts) {
        Map<Long, AccountEntity> accountsById = accounts.stream()
                .collect(Collectors.toMap(AccountEntity::getId, Function.identity()));
        Map<Long, InstrumentEntity> instrumentsById = instrumentJpaRepository
                .findAllById(positions.stream().map(PositionEntity::getInstrumentId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(InstrumentEntity::getId, Function.identity()));

        return positions.stream()
                .filter(p -> accountsById.containsKey(p.getAccountId()))
                .sorted(Comparator.comparing(PositionEntity::getAccountId).thenComparing(PositionEntity::getId))
                .map(p -> {
                    InstrumentEntity instrument = instrumentsById.get(p.getInstrumentId());
                    return Holding.builder()
                            .positionId(p.getId())
                            .accountId(p.getAccountId())
                            .accountName(accountsById.get(p.getAccountId()).getName())
                            .instrumentId(p.getInstrumentId())
                            .symbol(instrument == null ? null : instrument.getSymbol())
                            .instrumentName(instrument == null ? null : instrument.getName())
                            .costPrice(p.getCostPrice())
                            .quantity(p.getQuantity())
                            .investedAmount(p.getInvestedAmount())
                            .tradingStyle(p.getTradingStyle() == null ? TradingStyle.SWING : p.getTradingStyle())
                            .build();
                })
                .toList();
    }

    private AccountEntity findAccount(Long id) {
        return accountJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Account", id));
    }

    private PositionEntity findPosition(Long id) {
        return positionJpaRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Position", id));
    }
}
