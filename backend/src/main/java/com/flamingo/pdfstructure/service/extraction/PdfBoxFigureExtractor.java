package com.flamingo.pdfstructure.service.extraction;

import com.flamingo.pdfstructure.config.StructureConfig;
import com.flamingo.pdfstructure.model.BoundingBox;
import com.flamingo.pdfstructure.model.Figure;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;
import org.springframework.stereotype.Component;

/**
 * Locates drawn images in a PDF and reports them as {@link Figure}s, page by page in draw order.
 *
 * <p>The bounding box comes from the current transformation matrix at the {@code Do} operator and
 * is flipped into top-down page coordinates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfBoxFigureExtractor {

  private final StructureConfig structureConfig;

  public List<Figure> extract(PDDocument document) {
    Set<Integer> excluded = new HashSet<>(structureConfig.getExtraction().getExcludePages());
    ImageLocator locator = new ImageLocator();
    int pageNumber = 0;
    for (PDPage page : document.getPages()) {
      pageNumber++;
      if (excluded.contains(pageNumber)) {
        continue;
      }
      try {
        locator.startPage(pageNumber, page.getCropBox().getHeight());
        locator.processPage(page);
      } catch (IOException e) {
        log.warn("Could not locate images on page {}: {}", pageNumber, e.getMessage());
      }
    }
    log.debug("Located {} figures", locator.figures.size());
    return locator.figures;
  }

  /** Records the placement of every image XObject drawn on a page. */
  private static final class ImageLocator extends PDFStreamEngine {

    private final List<Figure> figures = new ArrayList<>();
    private int pageNumber;
    private float pageHeight;
    private int imageIndex;

    ImageLocator() {
      addOperator(new DrawObject(this));
    }

    void startPage(int number, float height) {
      this.pageNumber = number;
      this.pageHeight = height;
      this.imageIndex = 0;
    }

    void addImage(COSName name) {
      Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
      float x = ctm.getTranslateX();
      float y = ctm.getTranslateY();
      float width = ctm.getScalingFactorX();
      float height = ctm.getScalingFactorY();
      BoundingBox bbox = new BoundingBox(x, pageHeight - (y + height), x + width, pageHeight - y);
      String path = String.format("page-%d/%s-%d", pageNumber, name.getName(), imageIndex++);
      figures.add(new Figure(path, null, null, pageNumber, bbox));
      log.debug("Image {} on page {} at {}", name.getName(), pageNumber, bbox);
    }

    /** Handles {@code Do}: images are recorded, form XObjects are descended into. */
    private static final class DrawObject extends OperatorProcessor {

      private final ImageLocator locator;

      DrawObject(ImageLocator locator) {
        super(locator);
        this.locator = locator;
      }

      @Override
      public void process(Operator operator, List<COSBase> operands) throws IOException {
        if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
          return;
        }
        PDXObject xObject = locator.getResources().getXObject(objectName);
        if (xObject instanceof PDImageXObject) {
          locator.addImage(objectName);
        } else if (xObject instanceof PDFormXObject form) {
          locator.showForm(form);
        }
      }

      @Override
      public String getName() {
        return OperatorName.DRAW_OBJECT;
      }
    }
  }
}
