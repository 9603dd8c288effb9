package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import com.bullrunhub.gameservice.games.bullrun.domain.model.PriceSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("NetworthCalculator")
class NetworthCalculatorTest {

    private final NetworthCalculator calculator = new NetworthCalculator();

    @Test
    @DisplayName("matured fixed deposit pays full interest")
    void fixedDeposit_matured() {
        FixedDeposit fd = new FixedDeposit("fd1", 100000, 12, 7.0, 1, 1, true);

        assertThat(calculator.fixedDepositsValue(List.of(fd), 3, 1)).isCloseTo(107000.00, within(0.001));
    }

    @Test
    @DisplayName("unmatured fixed deposit accrues interest by elapsed months")
    void fixedDeposit_halfway() {
        FixedDeposit fd = new FixedDeposit("fd1", 100000, 12, 7.0, 1, 1, false);

        assertThat(calculator.fixedDepositsValue(List.of(fd), 1, 7)).isCloseTo(103500.00, within(0.001));
    }

    @Test
    @DisplayName("elapsed months are clamped to the deposit duration")
    void fixedDeposit_elapsedClamped() {
        FixedDeposit fd = new FixedDeposit("fd1", 100000, 12, 7.0, 2, 6, false);

        assertThat(calculator.fixedDepositsValue(List.of(fd), 5, 1)).isCloseTo(107000.00, within(0.001));
        assertThat(calculator.fixedDepositsValue(List.of(fd), 1, 1)).isCloseTo(100000.00, within(0.001));
    }

    @Test
    @DisplayName("zero claim against zero valuation is valid")
    void validate_bothZero() {
        NetworthValidation v = calculator.validateNetworth(0, 0);

        assertThat(v.valid()).isTrue();
        assertThat(v.deviation()).isZero();
    }

    @Test
    @DisplayName("non-zero claim against zero valuation is a 100% deviation")
    void validate_serverZero() {
        NetworthValidation v = calculator.validateNetworth(100, 0);

        assertThat(v.valid()).isFalse();
        assertThat(v.deviation()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("claims within 0.5% are accepted")
    void validate_tolerance() {
        assertThat(calculator.validateNetworth(100400, 100000).valid()).isTrue();
        assertThat(calculator.validateNetworth(100600, 100000).valid()).isFalse();
        assertThat(calculator.validateNetworth(99400, 100000).valid()).isFalse();
    }

    @Test
    @DisplayName("holdings are valued at authoritative prices with missing prices counted as zero")
    void calculate_holdings() throws Exception {
        JsonNode selected = new ObjectMapper().readTree("""
                {"fundName":"NIFTYBEES","commodity":"SILVER","stocks":["TCS"]}
                """);
        Holdings h = new Holdings();
        h.setPhysicalGold(AssetHolding.of(2));
        h.setDigitalGold(AssetHolding.of(1));
        h.setIndexFund(AssetHolding.of(10));
        h.setMutualFund(AssetHolding.of(5));
        h.getStocks().put("TCS", AssetHolding.of(3));
        h.getStocks().put("INFY", AssetHolding.of(4));
        h.getCrypto().put("BTC", AssetHolding.of(0.5));
        h.setCommodity(AssetHolding.of(7));
        h.getReits().put("EMBASSY", AssetHolding.of(20));
        PriceSnapshot prices = new PriceSnapshot(Map.of(
                "Physical_Gold", 5000.0,
                "Digital_Gold", 4900.0,
                "NIFTYBEES", 200.0,
                "TCS", 3000.0,
                "BTC", 40000.0,
                "SILVER", 70.0,
                "EMBASSY", 350.0));

        Valuation v = calculator.calculateServerNetworth(1000, 500, List.of(), h, prices, selected, 1, 1);

        assertThat(v.breakdown()).containsEntry("gold", 14900.0)
                .containsEntry("funds", 3000.0)
                .containsEntry("stocks", 9000.0)
                .containsEntry("crypto", 20000.0)
                .containsEntry("commodities", 490.0)
                .containsEntry("reits", 7000.0)
                .containsEntry("cash", 1000.0)
                .containsEntry("savings", 500.0);
        assertThat(v.total()).isCloseTo(55890.0, within(0.001));
    }

    @Test
    @DisplayName("full validation attaches the category breakdown")
    void fullValidation_attachesBreakdown() {
        NetworthValidation v = calculator.fullValidation(1500, 1000, 500, null, null, PriceSnapshot.EMPTY, null, 1, 1);

        assertThat(v.valid()).isTrue();
        assertThat(v.serverNetworth()).isEqualTo(1500.0);
        assertThat(v.breakdown()).containsEntry("cash", 1000.0).containsEntry("fixedDeposits", 0.0);
    }
}
