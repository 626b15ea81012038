package com.ospicorp.labnotebook.web;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of flat rows as {@code text/csv} with a header line. Map rows take their
 * columns from the keys, in first-seen order; any other element type uses its bean properties.
 * List cells are joined with {@code ;}.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> rows = (Collection<?>) object;
    CsvSchema schema = determineSchema(rows);
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private CsvSchema determineSchema(Collection<?> rows) {
    Object sample = null;
    for (Object element : rows) {
      if (element != null) {
        sample = element;
        break;
      }
    }
    if (sample instanceof Map<?, ?>) {
      Set<String> columns = new LinkedHashSet<>();
      for (Object element : rows) {
        if (element instanceof Map<?, ?> map) {
          for (Object key : map.keySet()) {
            if (key != null) {
              columns.add(key.toString());
            }
          }
        }
      }
      CsvSchema.Builder builder = CsvSchema.builder();
      columns.forEach(column -> builder.addColumn(column, CsvSchema.ColumnType.NUMBER_OR_STRING));
      return builder.setUseHeader(true).setArrayElementSeparator(";").build();
    }
    if (sample != null) {
      return mapper.schemaFor(sample.getClass()).withHeader();
    }
    return CsvSchema.emptySchema();
  }
}
