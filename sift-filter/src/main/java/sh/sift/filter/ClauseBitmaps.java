// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.filter;

import java.util.ArrayList;
import java.util.List;

import org.roaringbitmap.longlong.Roaring64Bitmap;

import sh.sift.core.types.Address;
import sh.sift.core.types.Signature;
import sh.sift.index.BitmapLookup;
import sh.sift.index.BitmapMatcher;
import sh.sift.index.IndexKind;

/**
 * Compiles filter clauses into a {@link BitmapMatcher}.
 *
 * <p>Per clause:
 * <ul>
 * <li>addresses only: union of the address bitmaps</li>
 * <li>signatures only: union of the signature bitmaps</li>
 * <li>both: intersection of the two unions</li>
 * </ul>
 * The matcher is the union over all clauses, log and call alike. Because the
 * intersection is taken per block rather than per log or call, the result is a superset
 * of the blocks {@link FilterClause#matches} accepts.
 */
public final class ClauseBitmaps {

    private ClauseBitmaps() {
    }

    /**
     * @param callFilters call clauses
     * @param logFilters  log clauses
     * @param kind        index kind the bitmaps come from; decides key tagging
     * @return matcher evaluating all clauses against one segment
     */
    public static BitmapMatcher matcher(
            final List<CallFilter> callFilters, final List<LogFilter> logFilters, final IndexKind kind) {
        final List<CompiledClause> compiled = new ArrayList<>(callFilters.size() + logFilters.size());
        for (LogFilter filter : logFilters) {
            compiled.add(compile(filter, kind));
        }
        for (CallFilter filter : callFilters) {
            compiled.add(compile(filter, kind));
        }
        return lookup -> {
            final Roaring64Bitmap out = new Roaring64Bitmap();
            for (CompiledClause clause : compiled) {
                out.or(clause.evaluate(lookup));
            }
            return out;
        };
    }

    /**
     * Evaluates a single clause.
     */
    public static Roaring64Bitmap clauseBitmap(
            final FilterClause clause, final BitmapLookup lookup, final IndexKind kind) {
        return compile(clause, kind).evaluate(lookup);
    }

    private static CompiledClause compile(final FilterClause clause, final IndexKind kind) {
        final List<String> addressKeys = new ArrayList<>(clause.addresses().size());
        for (Address address : clause.addresses()) {
            addressKeys.add(kind.key(clause.origin(), address.keyHex()));
        }
        final List<String> signatureKeys = new ArrayList<>(clause.signatures().size());
        for (Signature signature : clause.signatures()) {
            signatureKeys.add(kind.key(clause.origin(), signature.keyHex()));
        }
        return new CompiledClause(List.copyOf(addressKeys), List.copyOf(signatureKeys));
    }

    private static Roaring64Bitmap union(final List<String> keys, final BitmapLookup lookup) {
        final Roaring64Bitmap out = new Roaring64Bitmap();
        for (String key : keys) {
            final Roaring64Bitmap bitmap = lookup.get(key);
            if (bitmap != null) {
                out.or(bitmap);
            }
        }
        return out;
    }

    private record CompiledClause(List<String> addressKeys, List<String> signatureKeys) {

        Roaring64Bitmap evaluate(final BitmapLookup lookup) {
            final boolean wantAddresses = !addressKeys.isEmpty();
            final boolean wantSignatures = !signatureKeys.isEmpty();
            if (wantAddresses && wantSignatures) {
                final Roaring64Bitmap matched = union(addressKeys, lookup);
                matched.and(union(signatureKeys, lookup));
                return matched;
            }
            if (wantAddresses) {
                return union(addressKeys, lookup);
            }
            if (wantSignatures) {
                return union(signatureKeys, lookup);
            }
            throw new IllegalStateException("clause without addresses or signatures");
        }
    }
}
