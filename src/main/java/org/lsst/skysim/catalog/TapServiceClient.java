package org.lsst.skysim.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.skysim.EquatorialCoordinate;
import org.lsst.skysim.Timed;

/**
 * Base class for catalog services reached through a synchronous TAP endpoint.
 * Subclasses supply the ADQL; queries are sent as a form encoded POST and the
 * result is requested as CSV. The query must name its columns uid,
 * designation, ra, dec, pmra, pmdec, parallax, flux and magnitude.
 *
 * @author tonyj
 */
public abstract class TapServiceClient implements CatalogService {

    private static final Logger LOG = Logger.getLogger(TapServiceClient.class.getName());
    static final String REQUESTED_BY = "org.lsst.skysim";

    private final URL url;
    private final int timeoutMillis;

    protected TapServiceClient(URL url) {
        this.url = url;
        this.timeoutMillis = 1000 * Integer.getInteger("org.lsst.skysim.catalogTimeoutSeconds", 60);
    }

    public URL getURL() {
        return url;
    }

    /**
     * Build the ADQL for a query.
     */
    protected abstract String buildQuery(CatalogQuery query);

    @Override
    public List<CatalogSource> performRadialSearch(EquatorialCoordinate center, double radius, int limit, double magnitudeLimit) throws CatalogException {
        CatalogQuery query = new CatalogQuery(center, radius, limit, magnitudeLimit);
        String adql = buildQuery(query);
        LOG.log(Level.FINE, "Querying {0}: {1}", new Object[]{url, adql});
        List<CatalogSource> result = Timed.execute(() -> execute(adql), "Query %s took %dms", query);
        LOG.log(Level.INFO, "{0} returned {1} sources", new Object[]{url, result.size()});
        return result;
    }

    private List<CatalogSource> execute(String adql) throws CatalogException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("REQUEST", "doQuery");
        form.put("LANG", "ADQL");
        form.put("FORMAT", "csv");
        form.put("QUERY", adql);
        byte[] body = encodeForm(form).getBytes(StandardCharsets.UTF_8);
        try {
            HttpURLConnection connection = (HttpURLConnection) url.openConnection();
            try {
                connection.setConnectTimeout(timeoutMillis);
                connection.setReadTimeout(timeoutMillis);
                connection.setRequestMethod("POST");
                connection.setDoOutput(true);
                connection.setRequestProperty("Content-Type", "application/x-www-form-urlencoded");
                connection.setRequestProperty("X-Requested-By", REQUESTED_BY);
                connection.setFixedLengthStreamingMode(body.length);
                try (OutputStream out = connection.getOutputStream()) {
                    out.write(body);
                }
                int status = connection.getResponseCode();
                if (status != HttpURLConnection.HTTP_OK) {
                    throw new CatalogException(String.format("TAP query to %s failed with status %d: %s", url, status, readError(connection)));
                }
                try (Reader in = new InputStreamReader(connection.getInputStream(), StandardCharsets.UTF_8)) {
                    return parse(in);
                }
            } finally {
                connection.disconnect();
            }
        } catch (CatalogException x) {
            throw x;
        } catch (IOException x) {
            throw new CatalogException("TAP query to " + url + " failed", x);
        }
    }

    private static String readError(HttpURLConnection connection) throws IOException {
        InputStream error = connection.getErrorStream();
        if (error == null) {
            return connection.getResponseMessage();
        }
        StringBuilder result = new StringBuilder();
        try (BufferedReader in = new BufferedReader(new InputStreamReader(error, StandardCharsets.UTF_8))) {
            for (;;) {
                String line = in.readLine();
                if (line == null) {
                    break;
                }
                result.append(line).append('\n');
            }
        }
        return result.toString().trim();
    }

    static String encodeForm(Map<String, String> form) {
        StringBuilder result = new StringBuilder();
        for (Map.Entry<String, String> entry : form.entrySet()) {
            if (result.length() > 0) {
                result.append('&');
            }
            result.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return result.toString();
    }

    /**
     * Parse a CSV response. The first record names the columns. Rows without a
     * usable position or magnitude are skipped; missing proper motion or
     * parallax read as zero, missing flux as NaN.
     *
     * @throws CatalogException If the response has no header or lacks a
     * required column
     */
    public static List<CatalogSource> parse(Reader reader) throws CatalogException {
        List<List<String>> records;
        try {
            records = readCSV(reader);
        } catch (IOException x) {
            throw new CatalogException("Error reading TAP response", x);
        }
        if (records.isEmpty()) {
            throw new CatalogException("Empty TAP response");
        }
        Map<String, Integer> columns = new HashMap<>();
        List<String> header = records.get(0);
        for (int i = 0; i < header.size(); i++) {
            columns.put(header.get(i).trim().toLowerCase(), i);
        }
        for (String required : new String[]{"ra", "dec", "magnitude"}) {
            if (!columns.containsKey(required)) {
                throw new CatalogException("TAP response has no " + required + " column, columns were " + header);
            }
        }
        List<CatalogSource> result = new ArrayList<>();
        for (List<String> record : records.subList(1, records.size())) {
            if (record.size() == 1 && record.get(0).isEmpty()) {
                continue;
            }
            double ra = number(record, columns, "ra", Double.NaN);
            double dec = number(record, columns, "dec", Double.NaN);
            double magnitude = number(record, columns, "magnitude", Double.NaN);
            if (Double.isNaN(ra) || Double.isNaN(dec) || Double.isNaN(magnitude)) {
                LOG.fine(() -> "Skipping incomplete record " + record);
                continue;
            }
            result.add(new CatalogSource(
                    text(record, columns, "uid"),
                    designation(text(record, columns, "designation")),
                    ra, dec,
                    number(record, columns, "pmra", 0),
                    number(record, columns, "pmdec", 0),
                    number(record, columns, "parallax", 0),
                    number(record, columns, "flux", Double.NaN),
                    magnitude));
        }
        return result;
    }

    private static String designation(String value) {
        return value == null ? null : value.trim().replaceAll("\\s+", " ");
    }

    private static String text(List<String> record, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= record.size()) {
            return null;
        }
        String value = record.get(index);
        return value.isEmpty() ? null : value;
    }

    private static double number(List<String> record, Map<String, Integer> columns, String name, double missing) {
        String value = text(record, columns, name);
        if (value == null) {
            return missing;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException x) {
            return missing;
        }
    }

    /**
     * Minimal RFC 4180 reader: comma separated, double quoted fields may
     * contain commas, newlines and doubled quotes.
     */
    static List<List<String>> readCSV(Reader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean closedQuote = false;
        boolean any = false;
        int c;
        while ((c = reader.read()) != -1) {
            any = true;
            if (c == '"') {
                if (quoted) {
                    quoted = false;
                    closedQuote = true;
                } else {
                    if (closedQuote) {
                        field.append('"');
                    }
                    quoted = true;
                    closedQuote = false;
                }
            } else if (quoted) {
                field.append((char) c);
            } else {
                closedQuote = false;
                handle(c, field, record, records);
            }
        }
        if (any && (field.length() > 0 || !record.isEmpty())) {
            record.add(field.toString());
            records.add(record);
        }
        return records;
    }

    private static void handle(int c, StringBuilder field, List<String> record, List<List<String>> records) {
        switch (c) {
            case ',':
                record.add(field.toString());
                field.setLength(0);
                break;
            case '\n':
                record.add(field.toString());
                field.setLength(0);
                records.add(new ArrayList<>(record));
                record.clear();
                break;
            case '\r':
                break;
            default:
                field.append((char) c);
        }
    }
}
