package com.libragraph.archive.core.catalog;

import com.libragraph.archive.formats.extract.Extractor;
import com.libragraph.archive.formats.extract.ExtractorRef;
import com.libragraph.archive.formats.extract.ExtractorRegistry;
import com.libragraph.archive.formats.extract.OwningItem;
import com.libragraph.archive.types.CatalogLookupException;
import com.libragraph.archive.types.ItemKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory registry of acquisition types, file types, instruments and the
 * allowed (acquisition type, file type) pairs.
 *
 * <p>Readers see an immutable snapshot; every write replaces the snapshot, so
 * classification never observes a half-applied update. Iteration follows
 * registration order, and re-registering a name keeps its original position.
 */
public class TypeCatalog {

    private record Snapshot(
            Map<String, AcqType> acqTypes,
            Map<String, FileType> fileTypes,
            Map<String, Instrument> instruments,
            Map<String, Set<String>> allowed
    ) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of(), Map.of());
    }

    private final ExtractorRegistry extractors;
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public TypeCatalog(ExtractorRegistry extractors) {
        this.extractors = extractors;
    }

    // -- Registration --

    public synchronized void registerOrUpdate(AcqType type) {
        checkKind(type.name(), type.extractorRef(), ItemKind.ACQUISITION);
        Snapshot s = snapshot;
        Map<String, AcqType> acqTypes = new LinkedHashMap<>(s.acqTypes());
        acqTypes.put(type.name(), type);
        snapshot = new Snapshot(Collections.unmodifiableMap(acqTypes), s.fileTypes(), s.instruments(), s.allowed());
    }

    public synchronized void registerOrUpdate(FileType type) {
        checkKind(type.name(), type.extractorRef(), ItemKind.FILE);
        Snapshot s = snapshot;
        Map<String, FileType> fileTypes = new LinkedHashMap<>(s.fileTypes());
        fileTypes.put(type.name(), type);
        snapshot = new Snapshot(s.acqTypes(), Collections.unmodifiableMap(fileTypes), s.instruments(), s.allowed());
    }

    public synchronized void registerOrUpdate(Instrument instrument) {
        Snapshot s = snapshot;
        Map<String, Instrument> instruments = new LinkedHashMap<>(s.instruments());
        instruments.put(instrument.name(), instrument);
        snapshot = new Snapshot(s.acqTypes(), s.fileTypes(), Collections.unmodifiableMap(instruments), s.allowed());
    }

    /**
     * Permits files of {@code fileType} in acquisitions of {@code acqType}.
     *
     * @throws CatalogLookupException if either type is not registered
     */
    public synchronized void allow(String acqType, String fileType) {
        Snapshot s = snapshot;
        if (!s.acqTypes().containsKey(acqType)) {
            throw new CatalogLookupException("Unknown acquisition type: " + acqType);
        }
        if (!s.fileTypes().containsKey(fileType)) {
            throw new CatalogLookupException("Unknown file type: " + fileType);
        }
        Map<String, Set<String>> allowed = new LinkedHashMap<>(s.allowed());
        Set<String> files = new LinkedHashSet<>(allowed.getOrDefault(acqType, Set.of()));
        files.add(fileType);
        allowed.put(acqType, Collections.unmodifiableSet(files));
        snapshot = new Snapshot(s.acqTypes(), s.fileTypes(), s.instruments(), Collections.unmodifiableMap(allowed));
    }

    private static void checkKind(String typeName, ExtractorRef ref, ItemKind expected) {
        if (ref instanceof ExtractorRef.Direct direct && direct.extractor().kind() != expected) {
            throw new IllegalArgumentException("Type '" + typeName + "' is bound to "
                    + direct.extractor().label() + ", which extracts " + direct.extractor().kind() + " metadata");
        }
    }

    // -- Lookup --

    public Optional<AcqType> acqType(String name) {
        return Optional.ofNullable(snapshot.acqTypes().get(name));
    }

    public Optional<FileType> fileType(String name) {
        return Optional.ofNullable(snapshot.fileTypes().get(name));
    }

    public Optional<Instrument> instrument(String name) {
        return Optional.ofNullable(snapshot.instruments().get(name));
    }

    public AcqType requireAcqType(String name) {
        return acqType(name).orElseThrow(() -> new CatalogLookupException("Unknown acquisition type: " + name));
    }

    public FileType requireFileType(String name) {
        return fileType(name).orElseThrow(() -> new CatalogLookupException("Unknown file type: " + name));
    }

    public Instrument requireInstrument(String name) {
        return instrument(name).orElseThrow(() -> new CatalogLookupException("Unknown instrument: " + name));
    }

    public List<AcqType> acqTypes() {
        return List.copyOf(snapshot.acqTypes().values());
    }

    public List<FileType> fileTypes() {
        return List.copyOf(snapshot.fileTypes().values());
    }

    public List<Instrument> instruments() {
        return List.copyOf(snapshot.instruments().values());
    }

    /** File types permitted in acquisitions of {@code acqType}, in file type registration order. */
    public List<FileType> allowedFileTypes(AcqType acqType) {
        Snapshot s = snapshot;
        Set<String> names = s.allowed().getOrDefault(acqType.name(), Set.of());
        List<FileType> result = new ArrayList<>(names.size());
        for (FileType ft : s.fileTypes().values()) {
            if (names.contains(ft.name())) {
                result.add(ft);
            }
        }
        return result;
    }

    // -- Extractor resolution --

    /** The extractor for a new acquisition of {@code type}, if the type has one. */
    public Optional<Extractor> resolveExtractor(AcqType type, OwningItem owner) {
        return type.extractor().map(ref -> extractors.resolve(ref, owner));
    }

    /** The extractor for a new file of {@code type}, if the type has one. */
    public Optional<Extractor> resolveExtractor(FileType type, OwningItem owner) {
        return type.extractor().map(ref -> extractors.resolve(ref, owner));
    }
}
