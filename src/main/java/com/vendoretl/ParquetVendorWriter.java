package com.vendoretl;

import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.WriteException;
import com.vendoretl.model.PartitionKey;
import com.vendoretl.model.RatingsDistribution;
import com.vendoretl.model.VendorRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializes one city's rows into a single Snappy-compressed Parquet file. The Avro schema is
 * embedded in the file footer, so readers need no external schema.
 *
 * <p>Rows are buffered by the caller and written in one pass; a failure leaves no usable file
 * behind and is never retried.
 */
@Slf4j
public class ParquetVendorWriter {

    static final Schema RATING_SCORE_SCHEMA = SchemaBuilder.record("RatingScore")
            .namespace("com.vendoretl")
            .fields()
            .requiredInt("score")
            .requiredInt("count")
            .requiredInt("percentage")
            .endRecord();

    static final Schema RATINGS_SCHEMA = SchemaBuilder.record("RatingsDistribution")
            .namespace("com.vendoretl")
            .fields()
            .requiredInt("total_count")
            .optionalString("created_at")
            .optionalString("updated_at")
            .name("scores").type().array().items(RATING_SCORE_SCHEMA).noDefault()
            .endRecord();

    public static final Schema SCHEMA = SchemaBuilder.record("VendorRow")
            .namespace("com.vendoretl")
            .fields()
            .name("vendor_id").type().stringType().noDefault()
            .name("name").type().stringType().noDefault()
            .name("city_id").type().stringType().noDefault()
            .name("rating").type().nullable().doubleType().noDefault()
            .name("delivery_fee").type().nullable().doubleType().noDefault()
            .name("categories").type().nullable().array().items().stringType().noDefault()
            .name("latitude").type().nullable().doubleType().noDefault()
            .name("longitude").type().nullable().doubleType().noDefault()
            .name("fetched_at").type(timestampMillis()).noDefault()
            .name("details").type().nullable().stringType().noDefault()
            .name("ratings").type(Schema.createUnion(Schema.create(Schema.Type.NULL), RATINGS_SCHEMA)).noDefault()
            .name("reviews").type().nullable().array().items().stringType().noDefault()
            .name("extraction_started_at").type(timestampMillis()).noDefault()
            .name("extraction_completed_at").type(timestampMillis()).noDefault()
            .endRecord();

    private final Path scratchDir;
    private final Configuration conf = new Configuration();

    public ParquetVendorWriter(Path scratchDir) {
        this.scratchDir = scratchDir;
    }

    /**
     * Local file a city's snapshot is written to; unique per city and run.
     */
    public Path targetFile(String cityId, Instant runStartedAt) {
        return scratchDir.resolve("city_id=" + cityId).resolve(PartitionKey.fileName(runStartedAt));
    }

    public Path write(String cityId, Instant runStartedAt, List<VendorRow> rows) {
        Path target = targetFile(cityId, runStartedAt).toAbsolutePath();
        long start = System.currentTimeMillis();
        try {
            Files.createDirectories(target.getParent());
            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                    .<GenericRecord>builder(new org.apache.hadoop.fs.Path(target.toUri()))
                    .withSchema(SCHEMA)
                    .withConf(conf)
                    .withCompressionCodec(CompressionCodecName.SNAPPY)
                    .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                    .build()) {
                for (VendorRow row : rows) {
                    writer.write(toRecord(row));
                }
            }
        } catch (IOException e) {
            throw new WriteException(ErrorKind.WRITE_IO,
                    "Failed to write " + target + " for city=" + cityId + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new WriteException(ErrorKind.WRITE_ENCODING,
                    "Failed to encode rows for city=" + cityId + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} rows for city={} to {} in {} ms", rows.size(), cityId, target, System.currentTimeMillis() - start);
        return target;
    }

    static GenericRecord toRecord(VendorRow row) {
        GenericRecord record = new GenericData.Record(SCHEMA);
        record.put("vendor_id", row.getVendorId());
        record.put("name", row.getName());
        record.put("city_id", row.getCityId());
        record.put("rating", row.getRating());
        record.put("delivery_fee", row.getDeliveryFee());
        record.put("categories", row.getCategories());
        record.put("latitude", row.getLatitude());
        record.put("longitude", row.getLongitude());
        record.put("fetched_at", row.getFetchedAt().toEpochMilli());
        record.put("details", row.getDetails());
        record.put("ratings", row.getRatings() == null ? null : toRecord(row.getRatings()));
        record.put("reviews", row.getReviews());
        record.put("extraction_started_at", row.getExtractionStartedAt().toEpochMilli());
        record.put("extraction_completed_at", row.getExtractionCompletedAt().toEpochMilli());
        return record;
    }

    private static GenericRecord toRecord(RatingsDistribution ratings) {
        List<GenericRecord> scores = new ArrayList<>(ratings.getScores().size());
        for (RatingsDistribution.Score score : ratings.getScores()) {
            GenericRecord record = new GenericData.Record(RATING_SCORE_SCHEMA);
            record.put("score", score.getScore());
            record.put("count", score.getCount());
            record.put("percentage", score.getPercentage());
            scores.add(record);
        }
        GenericRecord record = new GenericData.Record(RATINGS_SCHEMA);
        record.put("total_count", ratings.getTotalCount());
        record.put("created_at", ratings.getCreatedAt());
        record.put("updated_at", ratings.getUpdatedAt());
        record.put("scores", scores);
        return record;
    }

    private static Schema timestampMillis() {
        return LogicalTypes.timestampMillis().addToSchema(Schema.create(Schema.Type.LONG));
    }
}
