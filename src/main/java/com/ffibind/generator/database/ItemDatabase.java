package com.ffibind.generator.database;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ffibind.generator.checks.CheckRecordResult;
import com.ffibind.generator.checks.CompatibilityLedger;
import com.ffibind.generator.exception.ItemNotFoundException;
import com.ffibind.generator.exception.ItemPathException;
import com.ffibind.generator.exception.PackageMismatchException;
import com.ffibind.generator.model.declaration.NativeDeclaration;
import com.ffibind.generator.model.ffi.FfiItem;
import com.ffibind.generator.model.id.FfiItemId;
import com.ffibind.generator.model.id.NativeItemId;
import com.ffibind.generator.model.id.SurfaceItemId;
import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.model.surface.SurfaceItem;
import com.ffibind.generator.model.target.Environment;
import com.ffibind.generator.util.NamingUtil;

import lombok.NonNull;

/**
 * All collected data of one generated package: native declarations, FFI
 * wrappers derived from them and the surface items generated from those.
 *
 * Each collection allocates its own identifiers in increasing order and keeps
 * items in identifier order. Identifiers are never reused, not even after a
 * clear. Inserting an item equal to a stored one is a no-op that only bumps the
 * ignored counter.
 *
 * Not thread-safe, except that {@link #recordCheck} may be called concurrently
 * while no other method runs.
 */
public class ItemDatabase {

    private static final Logger log = LoggerFactory.getLogger(ItemDatabase.class);

    public static final String INITIAL_VERSION = "0.0.0";

    private final String packageName;
    private String packageVersion;

    private final List<NativeDatabaseItem> nativeItems = new ArrayList<>();
    private final List<FfiDatabaseItem> ffiItems = new ArrayList<>();
    private final List<SurfaceDatabaseItem> surfaceItems = new ArrayList<>();
    private final List<Environment> environments = new ArrayList<>();

    private int nextNativeId;
    private int nextFfiId;
    private int nextSurfaceId;

    private volatile boolean modified;

    private int itemsAdded;
    private int itemsIgnored;

    private ItemDatabase(String packageName, String packageVersion) {
        this.packageName = packageName;
        this.packageVersion = packageVersion;
    }

    /**
     * Creates an empty database. It counts as modified until saved.
     */
    public static ItemDatabase empty(@NonNull String packageName) {
        return create(DatabaseConfig.builder().packageName(packageName).build());
    }

    public static ItemDatabase create(@NonNull DatabaseConfig config) {
        ItemDatabase database = new ItemDatabase(config.getPackageName(), config.getPackageVersion());
        database.nextNativeId = 1;
        database.nextFfiId = 1;
        database.nextSurfaceId = 1;
        database.modified = true;
        return database;
    }

    /**
     * Restores a database written earlier. The result counts as unmodified.
     */
    public static ItemDatabase fromSnapshot(@NonNull DatabaseSnapshot snapshot) {
        ItemDatabase database = new ItemDatabase(snapshot.getPackageName(), snapshot.getPackageVersion());
        database.nativeItems.addAll(snapshot.getNativeItems());
        for (DatabaseSnapshot.FfiEntry entry : snapshot.getFfiItems()) {
            database.ffiItems.add(new FfiDatabaseItem(entry.getId(), entry.getItem(),
                    new CompatibilityLedger(entry.getChecks()), entry.isSurfaceProcessed()));
        }
        database.surfaceItems.addAll(snapshot.getSurfaceItems());
        database.environments.addAll(snapshot.getEnvironments());
        database.nativeItems.sort((a, b) -> a.getId().compareTo(b.getId()));
        database.ffiItems.sort((a, b) -> a.getId().compareTo(b.getId()));
        database.surfaceItems.sort((a, b) -> a.getId().compareTo(b.getId()));
        database.nextNativeId = Math.max(snapshot.getNextNativeId(),
                nextAfter(database.nativeItems, item -> item.getId().getValue()));
        database.nextFfiId = Math.max(snapshot.getNextFfiId(),
                nextAfter(database.ffiItems, item -> item.getId().getValue()));
        database.nextSurfaceId = Math.max(snapshot.getNextSurfaceId(),
                nextAfter(database.surfaceItems, item -> item.getId().getValue()));
        database.modified = false;
        return database;
    }

    public DatabaseSnapshot toSnapshot() {
        DatabaseSnapshot.DatabaseSnapshotBuilder builder = DatabaseSnapshot.builder()
                .packageName(packageName)
                .packageVersion(packageVersion)
                .nativeItems(nativeItems)
                .surfaceItems(surfaceItems)
                .environments(environments)
                .nextNativeId(nextNativeId)
                .nextFfiId(nextFfiId)
                .nextSurfaceId(nextSurfaceId);
        for (FfiDatabaseItem item : ffiItems) {
            builder.ffiItem(DatabaseSnapshot.FfiEntry.of(item.getId(), item.getItem(),
                    item.getChecks().entries(), item.isSurfaceProcessed()));
        }
        return builder.build();
    }

    public String packageName() {
        return packageName;
    }

    public String packageVersion() {
        return packageVersion;
    }

    public void setPackageVersion(@NonNull String version) {
        if (!packageVersion.equals(version)) {
            modified = true;
            packageVersion = version;
        }
    }

    /**
     * Returns true if anything changed since creation, restore or the last {@link #setSaved()}.
     */
    public boolean isModified() {
        return modified;
    }

    public void setSaved() {
        modified = false;
    }

    // ---------------------------------------------------------------------
    // Native items
    // ---------------------------------------------------------------------

    public List<NativeDatabaseItem> nativeItems() {
        return Collections.unmodifiableList(nativeItems);
    }

    public List<NativeItemId> nativeItemIds() {
        return nativeItems.stream().map(NativeDatabaseItem::getId).toList();
    }

    public NativeDatabaseItem nativeItem(@NonNull NativeItemId id) {
        int index = binarySearch(nativeItems, id, NativeDatabaseItem::getId);
        if (index < 0) {
            throw new ItemNotFoundException("invalid native item id: " + id);
        }
        return nativeItems.get(index);
    }

    /**
     * Adds a native declaration unless an equal one is already stored.
     *
     * @param originFfiItem FFI item the declaration was synthesized from, or null for parsed declarations
     * @return the new identifier, or empty if the declaration was a duplicate
     */
    public Optional<NativeItemId> addNativeItem(FfiItemId originFfiItem, @NonNull NativeDeclaration declaration) {
        if (nativeItems.stream().anyMatch(item -> item.getDeclaration().equals(declaration))) {
            itemsIgnored++;
            return Optional.empty();
        }
        modified = true;
        NativeItemId id = NativeItemId.of(nextNativeId++);
        NativeDatabaseItem item = new NativeDatabaseItem(id, declaration, originFfiItem);
        log.debug("added native item #{}: {}", id, declaration.describe());
        log.trace("native item data: {}", item);
        nativeItems.add(item);
        itemsAdded++;
        return Optional.of(id);
    }

    /**
     * Removes all native items and registered environments. Run before parsing again.
     */
    public void clearNativeItems() {
        modified = true;
        log.debug("clearing {} native items and {} environments", nativeItems.size(), environments.size());
        nativeItems.clear();
        environments.clear();
    }

    // ---------------------------------------------------------------------
    // FFI items
    // ---------------------------------------------------------------------

    public List<FfiDatabaseItem> ffiItems() {
        return Collections.unmodifiableList(ffiItems);
    }

    public FfiDatabaseItem ffiItem(@NonNull FfiItemId id) {
        int index = binarySearch(ffiItems, id, FfiDatabaseItem::getId);
        if (index < 0) {
            throw new ItemNotFoundException("invalid ffi item id: " + id);
        }
        return ffiItems.get(index);
    }

    /**
     * Same as {@link #ffiItem} for callers about to change the item.
     */
    public FfiDatabaseItem ffiItemForUpdate(@NonNull FfiItemId id) {
        FfiDatabaseItem item = ffiItem(id);
        modified = true;
        return item;
    }

    public Optional<FfiItemId> findFfiItemId(@NonNull FfiItem item) {
        return ffiItems.stream()
                .filter(stored -> stored.getItem().equals(item))
                .map(FfiDatabaseItem::getId)
                .findFirst();
    }

    /**
     * Adds an FFI item unless an equal one is already stored.
     *
     * @return true if the item was inserted
     */
    public boolean addFfiItem(@NonNull FfiItem item) {
        if (ffiItems.stream().anyMatch(stored -> stored.getItem().equals(item))) {
            itemsIgnored++;
            return false;
        }
        modified = true;
        FfiItemId id = FfiItemId.of(nextFfiId++);
        log.debug("added ffi item #{}: {}", id, item.describe());
        ffiItems.add(new FfiDatabaseItem(id, item, new CompatibilityLedger(), false));
        itemsAdded++;
        return true;
    }

    /**
     * Removes all FFI items and every native item that was synthesized from one.
     */
    public void clearFfiItems() {
        modified = true;
        int before = nativeItems.size();
        ffiItems.clear();
        nativeItems.removeIf(NativeDatabaseItem::isSynthesized);
        log.debug("cleared ffi items and {} synthesized native items", before - nativeItems.size());
    }

    public void clearAllCheckResults() {
        modified = true;
        for (FfiDatabaseItem item : ffiItems) {
            item.getChecks().clear();
        }
    }

    /**
     * Records a check result for an FFI item. Safe to call from several threads
     * at once, also for the same item.
     */
    public CheckRecordResult recordCheck(@NonNull FfiItemId id, @NonNull Environment environment, String error) {
        CheckRecordResult result = ffiItem(id).getChecks().record(environment, error);
        if (result.getKind() != CheckRecordResult.Kind.UNCHANGED) {
            modified = true;
        }
        return result;
    }

    public void markSurfaceProcessed(@NonNull FfiItemId id) {
        FfiDatabaseItem item = ffiItem(id);
        if (!item.isSurfaceProcessed()) {
            item.setSurfaceProcessed(true);
            modified = true;
        }
    }

    /**
     * FFI items that passed in at least one environment and were not consumed by surface generation yet.
     */
    public List<FfiDatabaseItem> ffiItemsReadyForSurface() {
        return ffiItems.stream().filter(FfiDatabaseItem::isReadyForSurface).toList();
    }

    // ---------------------------------------------------------------------
    // Surface items
    // ---------------------------------------------------------------------

    public List<SurfaceDatabaseItem> surfaceItems() {
        return Collections.unmodifiableList(surfaceItems);
    }

    public SurfaceDatabaseItem surfaceItem(@NonNull SurfaceItemId id) {
        int index = binarySearch(surfaceItems, id, SurfaceDatabaseItem::getId);
        if (index < 0) {
            throw new ItemNotFoundException("invalid surface item id: " + id);
        }
        return surfaceItems.get(index);
    }

    public Optional<SurfaceDatabaseItem> findSurfaceItem(@NonNull ItemPath path) {
        return surfaceItems.stream()
                .filter(item -> item.path().equals(path))
                .findFirst();
    }

    /**
     * Direct children of {@code parent}. Each iteration scans the current items again.
     */
    public Iterable<SurfaceDatabaseItem> surfaceChildren(@NonNull ItemPath parent) {
        return () -> surfaceItems.stream()
                .filter(item -> item.getItem().isChildOf(parent))
                .iterator();
    }

    /**
     * Adds a surface item after checking that it belongs to this package and
     * that all of its ancestors are stored.
     *
     * @return identifier of the new item, or of the stored item equal to it
     * @throws PackageMismatchException if the item's package is not this database's package
     * @throws ItemPathException if an ancestor path has no stored item
     */
    public SurfaceItemId addSurfaceItem(@NonNull SurfaceItem item) {
        validateSurfaceItem(item);

        Optional<SurfaceDatabaseItem> existing = surfaceItems.stream()
                .filter(stored -> stored.getItem().equals(item))
                .findFirst();
        if (existing.isPresent()) {
            itemsIgnored++;
            return existing.get().getId();
        }

        modified = true;
        SurfaceItemId id = SurfaceItemId.of(nextSurfaceId++);
        log.debug("added surface item #{}: {}", id, item.describe());
        surfaceItems.add(new SurfaceDatabaseItem(id, item));
        itemsAdded++;
        return id;
    }

    private void validateSurfaceItem(SurfaceItem item) {
        ItemPath path = item.path();
        if (item.isPackageRoot()) {
            if (path.parent().isPresent() || !packageName.equals(path.firstSegment())) {
                throw new PackageMismatchException(packageName, path.firstSegment(), item.describe());
            }
            return;
        }

        if (!packageName.equals(path.firstSegment())) {
            throw new PackageMismatchException(packageName, path.firstSegment(), item.describe());
        }
        Optional<ItemPath> ancestor = path.parent();
        if (ancestor.isEmpty()) {
            throw new ItemPathException("surface item has no parent", path);
        }
        while (ancestor.isPresent()) {
            if (findSurfaceItem(ancestor.get()).isEmpty()) {
                throw new ItemPathException("unreachable ancestor of surface item " + path, ancestor.get());
            }
            ancestor = ancestor.get().parent();
        }
    }

    /**
     * Removes all surface items and marks every FFI item as not yet consumed.
     */
    public void clearSurfaceItems() {
        modified = true;
        surfaceItems.clear();
        for (FfiDatabaseItem item : ffiItems) {
            item.setSurfaceProcessed(false);
        }
    }

    /**
     * Returns {@code desired} if no surface item occupies it, otherwise the first
     * free path among {@code name_2}, {@code name_3}, ...
     */
    public ItemPath makeUniquePath(@NonNull ItemPath desired) {
        ItemPath candidate = desired;
        int number = 1;
        while (findSurfaceItem(candidate).isPresent()) {
            number++;
            candidate = desired.withLastSegment(NamingUtil.withNumericSuffix(desired.lastSegment(), number));
        }
        return candidate;
    }

    // ---------------------------------------------------------------------
    // Environments and counters
    // ---------------------------------------------------------------------

    public List<Environment> environments() {
        return Collections.unmodifiableList(environments);
    }

    public void registerEnvironment(@NonNull Environment environment) {
        if (!environments.contains(environment)) {
            modified = true;
            environments.add(environment);
        }
    }

    /**
     * Returns the counters accumulated since the last drain and resets them.
     */
    public ItemCounters drainCounters() {
        ItemCounters counters = ItemCounters.of(itemsAdded, itemsIgnored);
        itemsAdded = 0;
        itemsIgnored = 0;
        return counters;
    }

    /**
     * Drains the counters and logs them if anything happened.
     */
    public ItemCounters reportCounters() {
        ItemCounters counters = drainCounters();
        if (!counters.isEmpty()) {
            if (counters.getIgnored() == 0) {
                log.info("Items added: {}", counters.getAdded());
            } else {
                log.info("Items added: {}, ignored: {}", counters.getAdded(), counters.getIgnored());
            }
        }
        return counters;
    }

    private static <T, K extends Comparable<K>> int binarySearch(List<T> items, K key, Function<T, K> keyOf) {
        int low = 0;
        int high = items.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = keyOf.apply(items.get(mid)).compareTo(key);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    private static <T> int nextAfter(List<T> items, Function<T, Integer> idOf) {
        return items.stream().map(idOf).max(Integer::compare).map(max -> max + 1).orElse(1);
    }
}
