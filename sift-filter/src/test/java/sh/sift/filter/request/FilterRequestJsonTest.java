// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter.request;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import sh.sift.core.error.FilterConfigurationException;
import sh.sift.core.model.Block;
import sh.sift.core.model.BlockHeader;
import sh.sift.core.model.LogEntry;
import sh.sift.core.model.TransactionReceipt;
import sh.sift.core.model.TransactionTrace;
import sh.sift.core.types.Address;
import sh.sift.core.types.Hash;
import sh.sift.core.types.HexData;
import sh.sift.filter.BlockTransform;
import sh.sift.filter.CombinedFilter;
import sh.sift.filter.FilteredBlockStream;
import sh.sift.index.IndexConfig;
import sh.sift.index.store.InMemorySegmentStore;

class FilterRequestJsonTest {

    private static final String TOKEN = "0x" + "a".repeat(40);
    private static final String TRANSFER = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    @Test
    void parsesFullRequest() {
        String json = """
                {
                  "callFilters": [{"addresses": ["%s"], "signatures": ["0xa9059cbb"]}],
                  "logFilters": [{"addresses": [], "eventSignatures": ["%s"]}],
                  "headerOnly": false,
                  "sendAllBlockHeaders": true
                }
                """.formatted(TOKEN, TRANSFER);

        FilterRequest request = FilterRequestJson.parse(json);

        assertEquals(List.of(TOKEN), request.callFilters().get(0).addresses());
        assertEquals(List.of("0xa9059cbb"), request.callFilters().get(0).signatures());
        assertEquals(List.of(TRANSFER), request.logFilters().get(0).eventSignatures());
        assertTrue(request.logFilters().get(0).addresses().isEmpty());
        assertFalse(request.headerOnly());
        assertTrue(request.sendAllBlockHeaders());
    }

    @Test
    void missingFieldsReadAsEmpty() {
        FilterRequest request = FilterRequestJson.parse("{\"logFilters\":[{\"addresses\":[\"" + TOKEN + "\"]}]}");

        assertTrue(request.callFilters().isEmpty());
        assertTrue(request.logFilters().get(0).eventSignatures().isEmpty());
        assertFalse(request.sendAllBlockHeaders());
    }

    @Test
    void unknownFieldsAreIgnored() {
        FilterRequest request = FilterRequestJson.parse("{\"headerOnly\":true,\"cursor\":\"abc\"}");

        assertTrue(request.headerOnly());
        assertFalse(request.hasClauses());
    }

    @Test
    void malformedJsonIsConfigurationError() {
        assertThrows(FilterConfigurationException.class, () -> FilterRequestJson.parse("{\"callFilters\": ["));
        assertThrows(FilterConfigurationException.class, () -> FilterRequestJson.parse("{\"callFilters\": 3}"));
        assertThrows(FilterConfigurationException.class, () -> FilterRequestJson.parse("  "));
    }

    @Test
    void invalidHexIsRejectedAtCompileTime() {
        FilterRequest request = FilterRequestJson.parse(
                "{\"callFilters\":[{\"addresses\":[\"0x1234\"]}]}");

        FilterConfigurationException ex = assertThrows(FilterConfigurationException.class,
                () -> request.toTransform(null, IndexConfig.defaults()));
        assertTrue(ex.getMessage().contains("0x1234"));
    }

    @Test
    void signatureOfUnsupportedWidthIsRejectedAtCompileTime() {
        FilterRequest request = FilterRequestJson.parse(
                "{\"logFilters\":[{\"eventSignatures\":[\"0xbbbb\"]}]}");

        FilterConfigurationException ex = assertThrows(FilterConfigurationException.class,
                () -> request.toTransform(null, IndexConfig.defaults()));
        assertTrue(ex.getMessage().contains("0xbbbb"));
    }

    @Test
    void emptyClauseIsRejected() {
        FilterRequest request = FilterRequestJson.parse("{\"logFilters\":[{}]}");

        assertThrows(FilterConfigurationException.class, () -> request.toTransform(null, IndexConfig.defaults()));
    }

    @Test
    void requestSelectingNothingIsRejected() {
        FilterRequest request = FilterRequestJson.parse("{\"sendAllBlockHeaders\":true}");

        assertThrows(FilterConfigurationException.class, () -> request.toTransform(null, IndexConfig.defaults()));
    }

    @Test
    void compiledFilterCarriesClausesAndHeaderFlag() {
        FilterRequest request = FilterRequestJson.parse("""
                {"logFilters":[{"addresses":["%s"],"eventSignatures":["%s"]}],"sendAllBlockHeaders":true}
                """.formatted(TOKEN, TRANSFER));
        InMemorySegmentStore store = new InMemorySegmentStore();

        CombinedFilter filter = request.toCombinedFilter(store, IndexConfig.defaults());

        assertNotNull(filter);
        assertTrue(filter.alwaysEmitHeader());
        assertEquals(new Address(TOKEN), filter.logFilters().get(0).addresses().iterator().next());
        assertNotNull(filter.compileIndexProvider());
    }

    @Test
    void headerOnlyIsAppliedAfterFiltering() {
        FilterRequest request = FilterRequestJson.parse("""
                {"logFilters":[{"addresses":["%s"]}],"headerOnly":true}
                """.formatted(TOKEN));
        BlockTransform transform = request.toTransform(null, IndexConfig.defaults());

        Optional<Block> matching = transform.apply(blockWithLog(7, new Address(TOKEN)));
        Optional<Block> other = transform.apply(blockWithLog(8, new Address("0x" + "b".repeat(40))));

        assertTrue(matching.isPresent());
        assertTrue(matching.get().transactionTraces().isEmpty());
        assertEquals(7, matching.get().number());
        assertTrue(other.isEmpty());
    }

    @Test
    void headerOnlyWithoutClausesPassesEveryBlock() {
        BlockTransform transform = FilterRequestJson.parse("{\"headerOnly\":true}")
                .toTransform(null, IndexConfig.defaults());

        Optional<Block> out = transform.apply(blockWithLog(9, new Address(TOKEN)));

        assertTrue(out.isPresent());
        assertTrue(out.get().transactionTraces().isEmpty());
    }

    @Test
    void openStreamRunsRequestEndToEnd() {
        FilterRequest request = FilterRequestJson.parse("""
                {"logFilters":[{"addresses":["%s"]}]}
                """.formatted(TOKEN));
        FilteredBlockStream stream = request.openStream(
                n -> n == 4 ? blockWithLog(4, new Address(TOKEN)) : blockWithLog(n, Address.ZERO),
                null,
                IndexConfig.defaults());
        List<Long> delivered = new ArrayList<>();

        stream.stream(0, 8, block -> delivered.add(block.number()));

        assertEquals(List.of(4L), delivered);
    }

    @Test
    void serializesBackToWireShape() {
        FilterRequest request = new FilterRequest(
                List.of(new FilterRequest.CallClause(List.of(TOKEN), List.of("0xa9059cbb"))),
                List.of(),
                true,
                false);

        String json = FilterRequestJson.toJson(request);

        assertTrue(json.contains("\"addresses\":[\"" + TOKEN + "\"]"));
        assertTrue(json.contains("\"signatures\":[\"0xa9059cbb\"]"));
        assertTrue(json.contains("\"logFilters\":[]"));
        assertTrue(json.contains("\"headerOnly\":true"));
        assertEquals(request, FilterRequestJson.parse(json));
    }

    private static Block blockWithLog(long number, Address emitter) {
        Hash hash = new Hash(String.format("0x%064x", number));
        LogEntry log = new LogEntry(emitter, List.of(new Hash(TRANSFER)), HexData.EMPTY, 0, 0, 0);
        TransactionTrace trace = TransactionTrace.builder()
                .hash(hash)
                .receipt(new TransactionReceipt(HexData.EMPTY, 0, HexData.EMPTY, List.of(log)))
                .build();
        BlockHeader header = new BlockHeader(hash, hash, Address.ZERO, hash, hash, HexData.EMPTY,
                number, 0, 0, 0, HexData.EMPTY, null);
        return new Block(1, hash, number, 0, header, List.of(), List.of(trace), List.of(), List.of());
    }
}
