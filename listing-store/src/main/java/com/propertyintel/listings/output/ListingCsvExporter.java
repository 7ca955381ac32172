package com.propertyintel.listings.output;

import com.opencsv.CSVWriter;
import com.propertyintel.listings.config.ListingStoreProperties;
import com.propertyintel.listings.model.Category;
import com.propertyintel.listings.model.IdentityFields;
import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.Snapshot;
import com.propertyintel.listings.model.VolatileFields;
import com.propertyintel.listings.store.ContentFingerprinter;
import com.propertyintel.listings.store.ListingDimension;
import com.propertyintel.listings.store.SnapshotStore;
import com.propertyintel.listings.store.TableSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Writes every live listing with its current snapshot to CSV.
 *
 * Output path pattern: {outputDir}/listings_{category}_{date}.csv
 * e.g. /data/output/listings_rent_2024-05-01.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingCsvExporter {

    private static final String[] HEADERS = {
            "listing_id", "category",
            "address_country", "address_province", "address_city", "address_municipality",
            "address_district", "address_neighbourhood", "address_street", "address_number",
            "address_suffix", "address_postal_code", "latitude", "longitude",
            "property_type", "construction_year",
            "first_seen_at", "last_seen_at",
            "snapshot_id", "snapshot_ts",
            "status", "price", "floor_area", "plot_area",
            "number_of_rooms", "number_of_bedrooms", "energy_label", "details_json"
    };

    private final ListingStoreProperties properties;
    private final ListingDimension listingDimension;
    private final SnapshotStore snapshotStore;
    private final ContentFingerprinter fingerprinter;

    public Path exportCurrent(Category category) {
        TableSet tables = TableSet.live(category);
        List<Listing> listings = listingDimension.findAll(tables);

        Path outputDir = Paths.get(properties.getExport().getOutputDir());
        ensureDirectory(outputDir);

        String filename = String.format("listings_%s_%s.csv", category.tablePrefix(), LocalDate.now(ZoneOffset.UTC));
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getExport().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            for (Listing listing : listings) {
                Snapshot current = listing.getCurrentSnapshotId() == null
                        ? null
                        : snapshotStore.findById(tables, listing.getCurrentSnapshotId()).orElse(null);
                writer.writeNext(toRow(listing, current));
            }

            log.info("Exported {} {} listings to CSV: {}", listings.size(), category, outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV export failed: " + outputPath, e);
        }
        return outputPath;
    }

    private String[] toRow(Listing l, Snapshot s) {
        IdentityFields id = l.getIdentity() != null ? l.getIdentity() : new IdentityFields();
        VolatileFields v = s != null ? s.getFields() : VolatileFields.builder().build();
        return new String[]{
                str(l.getListingId()),
                str(l.getCategory()),
                str(id.getCountry()),
                str(id.getProvince()),
                str(id.getCity()),
                str(id.getMunicipality()),
                str(id.getDistrict()),
                str(id.getNeighbourhood()),
                str(id.getStreet()),
                str(id.getHouseNumber()),
                str(id.getHouseNumberSuffix()),
                str(id.getPostalCode()),
                str(id.getLatitude()),
                str(id.getLongitude()),
                str(id.getPropertyType()),
                str(id.getConstructionYear()),
                str(l.getFirstSeenAt()),
                str(l.getLastSeenAt()),
                s == null ? "" : str(s.getSnapshotId()),
                s == null ? "" : str(s.getSnapshotTs()),
                str(v.getStatus()),
                v.getPrice() == null ? "" : v.getPrice().toPlainString(),
                str(v.getFloorArea()),
                str(v.getPlotArea()),
                str(v.getNumberOfRooms()),
                str(v.getNumberOfBedrooms()),
                str(v.getEnergyLabel()),
                str(fingerprinter.canonicalDetailsJson(v.getDetails()))
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
