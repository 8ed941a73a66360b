/* (C)2026 */
package com.ammann.reflectometry.resource;

import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.dto.OrsoDocumentDTO;
import com.ammann.reflectometry.dto.RawMeasurementDTO;
import com.ammann.reflectometry.dto.ReductionConfigurationDTO;
import com.ammann.reflectometry.exception.MetadataReadException;
import com.ammann.reflectometry.properties.ApiProperties;
import com.ammann.reflectometry.provider.MetadataProvider;
import com.ammann.reflectometry.provider.RawMeasurementMetadataProvider;
import com.ammann.reflectometry.provider.ScanLogMetadataProvider;
import com.ammann.reflectometry.service.OrsoTextWriter;
import com.ammann.reflectometry.service.ReductionService;
import com.ammann.reflectometry.service.ResultAssemblerService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource reducing raw reflectometry measurements to reflectivity curves.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Reduction.BASE)
@Tag(name = "Reduction API", description = "Reduction of reflectometry scans to R(Q)")
public class ReductionResource {

    private static final Logger LOG = Logger.getLogger(ReductionResource.class);
    private static final String ORSO_MEDIA_TYPE = MediaType.TEXT_PLAIN + ";charset=UTF-8";

    @Inject ReductionService reductionService;

    @Inject ResultAssemblerService assembler;

    @Inject OrsoTextWriter writer;

    @Inject CorrectionParameters parameters;

    @POST
    @Path(ApiProperties.Reduction.SCAN_LOG)
    @Consumes(MediaType.TEXT_PLAIN)
    @Produces(ORSO_MEDIA_TYPE)
    @Operation(
            summary = "Reduce scan log",
            description = "Reduces a scan log file and returns the reflectivity file in ORSO text format")
    public Response reduceScanLog(
            @QueryParam("fileName") @DefaultValue("scan.dat") String fileName, String content) {
        OrsoDocumentDTO document = reduceScanLogDocument(fileName, content);
        String outputName = OrsoTextWriter.stem(java.nio.file.Path.of(fileName)) + ".ort";
        return Response.ok(writer.write(document))
                .header("Content-Disposition", "attachment; filename=\"" + outputName + "\"")
                .build();
    }

    @POST
    @Path(ApiProperties.Reduction.SCAN_LOG_DOCUMENT)
    @Consumes(MediaType.TEXT_PLAIN)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Reduce scan log to JSON",
            description = "Reduces a scan log file and returns the reflectivity document as JSON")
    public Response reduceScanLogToDocument(
            @QueryParam("fileName") @DefaultValue("scan.dat") String fileName, String content) {
        return Response.ok(reduceScanLogDocument(fileName, content)).build();
    }

    @POST
    @Path(ApiProperties.Reduction.RAW)
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Reduce raw measurement",
            description = "Reduces a measurement submitted as JSON columns and detector frames")
    public Response reduceRawMeasurement(
            @Valid @NotNull(message = "Request body with the raw measurement is required")
                    RawMeasurementDTO measurement) {
        MetadataProvider provider = new RawMeasurementMetadataProvider(measurement);
        return Response.ok(reduce(provider, "POST " + ApiProperties.Reduction.RAW)).build();
    }

    @GET
    @Path(ApiProperties.Reduction.CONFIGURATION)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Active configuration",
            description = "Returns the correction parameters applied to every reduction")
    public Response getConfiguration() {
        ReductionConfigurationDTO configuration = assembler.describe(parameters);
        return Response.ok(configuration).build();
    }

    private OrsoDocumentDTO reduceScanLogDocument(String fileName, String content) {
        if (content == null || content.isBlank()) {
            throw new MetadataReadException("Request body with the scan log is required");
        }
        MetadataProvider provider = ScanLogMetadataProvider.fromContent(fileName, content);
        return reduce(provider, "POST " + ApiProperties.Reduction.SCAN_LOG + "?fileName=" + fileName);
    }

    private OrsoDocumentDTO reduce(MetadataProvider provider, String call) {
        LOG.debugf("Reduction requested for %s", provider.filePath());
        ReductionService.ReductionResult result =
                reductionService.reduce(provider, parameters.withProgramCall(call));
        return assembler.assemble(result);
    }
}
