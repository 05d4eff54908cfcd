package com.stakeduel.service;

import com.stakeduel.model.CreditCashout;
import com.stakeduel.model.CreditPurchase;
import com.stakeduel.model.EventKind;
import com.stakeduel.model.LedgerAccount;
import com.stakeduel.model.LedgerReason;
import com.stakeduel.provider.VerificationProvider;
import com.stakeduel.repository.CreditCashoutRepository;
import com.stakeduel.repository.CreditPurchaseRepository;
import com.stakeduel.web.StakeLedgerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Converts external assets into credits and back. The price is read before the ledger
 * transaction starts so no account lock is held across the oracle call.
 */
@Service
public class CreditExchangeService {

    private static final Logger log = LoggerFactory.getLogger(CreditExchangeService.class);

    private final PlatformSettingsService platformSettingsService;
    private final PricingOracleService pricingOracleService;
    private final AssetRegistryService assetRegistryService;
    private final LedgerService ledgerService;
    private final EventLogService eventLogService;
    private final VerificationProvider verificationProvider;
    private final CreditPurchaseRepository creditPurchaseRepository;
    private final CreditCashoutRepository creditCashoutRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CreditExchangeService(
            PlatformSettingsService platformSettingsService,
            PricingOracleService pricingOracleService,
            AssetRegistryService assetRegistryService,
            LedgerService ledgerService,
            EventLogService eventLogService,
            VerificationProvider verificationProvider,
            CreditPurchaseRepository creditPurchaseRepository,
            CreditCashoutRepository creditCashoutRepository,
            TransactionTemplate transactionTemplate,
            Clock clock
    ) {
        this.platformSettingsService = platformSettingsService;
        this.pricingOracleService = pricingOracleService;
        this.assetRegistryService = assetRegistryService;
        this.ledgerService = ledgerService;
        this.eventLogService = eventLogService;
        this.verificationProvider = verificationProvider;
        this.creditPurchaseRepository = creditPurchaseRepository;
        this.creditCashoutRepository = creditCashoutRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public ExchangeReceipt purchase(String accountId, String assetId, BigInteger assetAmount) {
        platformSettingsService.requireNotPaused();
        if (assetAmount == null || assetAmount.signum() <= 0) {
            throw StakeLedgerException.invalidInput("assetAmount must be positive");
        }
        if (!verificationProvider.isVerified(accountId)) {
            log.warn("purchase_rejected accountId={} reason=unverified", accountId);
            throw StakeLedgerException.unverified(accountId);
        }
        pricingOracleService.requireWithinBounds(assetRegistryService.getActiveAsset(assetId), assetAmount);

        PricingOracleService.AssetQuote quote = pricingOracleService.getPrice(assetId);
        long credits = pricingOracleService.assetAmountToCredits(quote, assetAmount);
        if (credits <= 0) {
            throw StakeLedgerException.invalidInput("assetAmount is worth less than one credit");
        }

        ExchangeReceipt receipt = transactionTemplate.execute(status -> {
            LedgerAccount account = ledgerService.lockOrCreateAccount(accountId);
            UUID purchaseId = UUID.randomUUID();
            ledgerService.credit(account, credits, LedgerReason.PURCHASE, purchaseId);

            CreditPurchase purchase = new CreditPurchase();
            purchase.setPurchaseId(purchaseId);
            purchase.setAccountId(accountId);
            purchase.setAssetId(assetId);
            purchase.setAssetAmount(assetAmount);
            purchase.setCredits(credits);
            purchase.setPrice(quote.quote().price());
            purchase.setPricePrecision(quote.quote().precision());
            purchase.setPriceObservedAt(OffsetDateTime.ofInstant(quote.quote().observedAt(), ZoneOffset.UTC));
            purchase.setCreatedAt(OffsetDateTime.now(clock));
            creditPurchaseRepository.save(purchase);

            eventLogService.append(account, EventKind.PURCHASE, purchaseId, new EventPayloads.Purchase(
                    assetId,
                    assetAmount,
                    credits,
                    quote.quote().price(),
                    quote.quote().precision(),
                    account.getCreditBalance()
            ));
            return toReceipt(purchaseId, accountId, assetId, assetAmount, credits, quote, account.getCreditBalance());
        });

        log.info("purchase_committed accountId={} assetId={} assetAmount={} credits={} balance={}",
                accountId, assetId, assetAmount, credits, receipt.balance());
        return receipt;
    }

    public ExchangeReceipt cashout(String accountId, String assetId, long credits) {
        platformSettingsService.requireNotPaused();
        if (credits <= 0) {
            throw StakeLedgerException.invalidInput("credits must be positive");
        }

        PricingOracleService.AssetQuote quote = pricingOracleService.getPrice(assetId);
        BigInteger assetAmount = pricingOracleService.cashoutAssetAmount(quote, credits);
        pricingOracleService.requireWithinBounds(quote.asset(), assetAmount);

        ExchangeReceipt receipt = transactionTemplate.execute(status -> {
            LedgerAccount account = ledgerService.lockAccount(accountId)
                    .orElseThrow(() -> StakeLedgerException.insufficientBalance(accountId, credits, 0L));
            UUID cashoutId = UUID.randomUUID();
            ledgerService.debit(account, credits, LedgerReason.CASHOUT, cashoutId);

            CreditCashout cashout = new CreditCashout();
            cashout.setCashoutId(cashoutId);
            cashout.setAccountId(accountId);
            cashout.setAssetId(assetId);
            cashout.setAssetAmount(assetAmount);
            cashout.setCredits(credits);
            cashout.setPrice(quote.quote().price());
            cashout.setPricePrecision(quote.quote().precision());
            cashout.setPriceObservedAt(OffsetDateTime.ofInstant(quote.quote().observedAt(), ZoneOffset.UTC));
            cashout.setCreatedAt(OffsetDateTime.now(clock));
            creditCashoutRepository.save(cashout);

            eventLogService.append(account, EventKind.CASHOUT, cashoutId, new EventPayloads.Cashout(
                    assetId,
                    assetAmount,
                    credits,
                    quote.quote().price(),
                    quote.quote().precision(),
                    account.getCreditBalance()
            ));
            return toReceipt(cashoutId, accountId, assetId, assetAmount, credits, quote, account.getCreditBalance());
        });

        log.info("cashout_committed accountId={} assetId={} assetAmount={} credits={} balance={}",
                accountId, assetId, assetAmount, credits, receipt.balance());
        return receipt;
    }

    private static ExchangeReceipt toReceipt(
            UUID referenceId,
            String accountId,
            String assetId,
            BigInteger assetAmount,
            long credits,
            PricingOracleService.AssetQuote quote,
            long balance
    ) {
        return new ExchangeReceipt(
                referenceId,
                accountId,
                assetId,
                assetAmount,
                credits,
                quote.quote().price(),
                quote.quote().precision(),
                OffsetDateTime.ofInstant(quote.quote().observedAt(), ZoneOffset.UTC),
                balance
        );
    }
}
